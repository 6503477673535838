package bastion.core.model.auth;

import java.util.Arrays;
import java.util.Optional;

/**
 * Credentials submitted with a login request.
 *
 * <p>The password is held as a char array so it can be wiped once the login
 * completes; call {@link #clear()} when the token is no longer needed.
 */
public final class UsernamePasswordToken {

    private final String username;
    private final char[] password;
    private final boolean rememberMe;
    private final String totpCode;
    private final String host;

    public UsernamePasswordToken(String username, char[] password) {
        this(username, password, false, null, null);
    }

    public UsernamePasswordToken(
            String username, char[] password, boolean rememberMe, String totpCode, String host) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or blank");
        }
        if (password == null) {
            throw new IllegalArgumentException("Password cannot be null");
        }
        this.username = username;
        this.password = password.clone();
        this.rememberMe = rememberMe;
        this.totpCode = totpCode;
        this.host = host;
    }

    public String username() {
        return username;
    }

    public char[] password() {
        return password;
    }

    public boolean rememberMe() {
        return rememberMe;
    }

    /**
     * Second-factor code submitted with the credentials, if any.
     */
    public Optional<String> totpCode() {
        return Optional.ofNullable(totpCode);
    }

    public Optional<String> host() {
        return Optional.ofNullable(host);
    }

    /**
     * Overwrite the password in memory.
     */
    public void clear() {
        Arrays.fill(password, '\0');
    }

    @Override
    public String toString() {
        return "UsernamePasswordToken[username=" + username + ", rememberMe=" + rememberMe + "]";
    }
}
