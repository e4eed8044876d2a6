package tech.terrareg.platform.authentication;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * JSON form of {@link ProviderClaims} as stored in sessions and Terraform tokens.
 */
@ApplicationScoped
public class ClaimsCodec {

    private static final Logger LOG = Logger.getLogger(ClaimsCodec.class);

    @Inject
    ObjectMapper objectMapper;

    public ClaimsCodec() {
    }

    public ClaimsCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(ProviderClaims claims) {
        try {
            return objectMapper.writeValueAsString(claims);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize provider claims", e);
        }
    }

    /**
     * Empty when the stored value is missing or unreadable.
     */
    public Optional<ProviderClaims> decode(String json) {
        if (json == null || json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, ProviderClaims.class));
        } catch (JsonProcessingException e) {
            LOG.warnf("Stored provider claims could not be read: %s", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
