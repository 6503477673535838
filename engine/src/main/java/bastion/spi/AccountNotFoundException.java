package bastion.spi;

/**
 * The account store has no record for a principal.
 */
public class AccountNotFoundException extends RuntimeException {

    public AccountNotFoundException(String principal) {
        super("Account not found: " + principal);
    }
}
