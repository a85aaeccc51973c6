package hasync.adapter.in.dto;

/**
 * DTO for administrator login.
 */
public record LoginRequest(String username, String password) {

    @Override
    public String toString() {
        return "LoginRequest[username=" + username + ", password=******]";
    }
}
