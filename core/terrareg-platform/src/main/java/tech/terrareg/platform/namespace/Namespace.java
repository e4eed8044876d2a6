package tech.terrareg.platform.namespace;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;

import java.time.Instant;
import java.util.Locale;

/**
 * Top-level grouping under which modules and providers live.
 *
 * Lookups use {@code nameLower}; {@code name} keeps the casing it was created with.
 */
@MongoEntity(collection = "namespaces")
public class Namespace extends PanacheMongoEntityBase {

    @BsonId
    public Long id;

    public String name;

    /**
     * Case-folded name, unique.
     */
    public String nameLower;

    public String displayName;

    public NamespaceType type = NamespaceType.ORGANISATION;

    public Instant createdAt = Instant.now();

    public static String fold(String name) {
        return name == null ? null : name.toLowerCase(Locale.ROOT);
    }

    public String displayNameOrName() {
        return displayName != null && !displayName.isBlank() ? displayName : name;
    }
}
