package bastion.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import bastion.core.model.auth.TotpSecret;

/**
 * Port through which one-time code secrets are read and enrolled.
 */
public interface TotpSecretSource {

    Uni<List<TotpSecret>> findTotpSecrets(String principal);

    Uni<Void> saveTotpSecret(TotpSecret secret);
}
