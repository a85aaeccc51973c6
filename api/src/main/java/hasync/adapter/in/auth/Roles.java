package hasync.adapter.in.auth;

import hasync.core.model.auth.Role;

/**
 * Security role names used in {@code @RolesAllowed}.
 */
public final class Roles {

    public static final String ADMIN = "admin";
    public static final String CLIENT = "client";

    private Roles() {}

    static String of(Role role) {
        return switch (role) {
            case ADMIN -> ADMIN;
            case CLIENT -> CLIENT;
        };
    }
}
