package tech.terrareg.platform.authentication.terraform;

import com.mongodb.client.model.Filters;
import io.quarkus.mongodb.panache.PanacheMongoRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Typed;

import java.time.Instant;
import java.util.Optional;

/**
 * MongoDB implementation of TerraformIdpRepository.
 *
 * Codes go through Panache on {@link TerraformAuthorizationCode}; tokens use the
 * active-record statics of {@link TerraformAccessToken}.
 */
@ApplicationScoped
@Typed(TerraformIdpRepository.class)
class MongoTerraformIdpRepository
        implements PanacheMongoRepositoryBase<TerraformAuthorizationCode, String>, TerraformIdpRepository {

    @Override
    public void persistCode(TerraformAuthorizationCode code) {
        persist(code);
    }

    @Override
    public Optional<TerraformAuthorizationCode> consumeCode(String codeHash) {
        return Optional.ofNullable(mongoCollection().findOneAndDelete(Filters.eq("_id", codeHash)));
    }

    @Override
    public long deleteExpiredCodes(Instant now) {
        return delete("expiry <= ?1", now);
    }

    @Override
    public void persistToken(TerraformAccessToken token) {
        token.persist();
    }

    @Override
    public Optional<TerraformAccessToken> findToken(String tokenHash) {
        return TerraformAccessToken.findByIdOptional(tokenHash);
    }

    @Override
    public long deleteExpiredTokens(Instant now) {
        return TerraformAccessToken.delete("expiry <= ?1", now);
    }
}
