package tech.terrareg.platform.authentication.terraform;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage for Terraform CLI authorization codes and access tokens, keyed by hash.
 */
public interface TerraformIdpRepository {

    // Authorization codes
    void persistCode(TerraformAuthorizationCode code);

    /**
     * Find and delete in one step, so a code can be redeemed only once.
     */
    Optional<TerraformAuthorizationCode> consumeCode(String codeHash);

    long deleteExpiredCodes(Instant now);

    // Access tokens
    void persistToken(TerraformAccessToken token);
    Optional<TerraformAccessToken> findToken(String tokenHash);
    long deleteExpiredTokens(Instant now);
}
