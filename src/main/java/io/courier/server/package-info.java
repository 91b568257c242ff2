/**
 * Server end of the messaging layer.
 *
 * <p>Every inbound message produces exactly one response on the sender's session, whatever happens
 * in middleware or handlers. Client-visible error texts come from {@link io.courier.server.RejectionKind};
 * details go to diagnostics only.
 */
package io.courier.server;
