/**
 * Courier source tree root: secure request/response messaging between one server and many clients.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.courier.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.courier.server.ServerRouter} validates, rate-limits and dispatches inbound requests.</li>
 *   <li>{@code io.courier.client.ClientRequestEngine} correlates requests with responses and enforces deadlines.</li>
 *   <li>{@code io.courier.middleware.MiddlewareChain} is the ordered step runner shared by both ends.</li>
 * </ul>
 */
package io.courier;
