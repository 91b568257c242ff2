package io.courier.server;

/**
 * Authorization decision supplied by the host, e.g. backed by a group or role lookup.
 */
@FunctionalInterface
public interface AdminPredicate {

    boolean isAdmin(String senderId);

    static AdminPredicate denyAll() {
        return senderId -> false;
    }
}
