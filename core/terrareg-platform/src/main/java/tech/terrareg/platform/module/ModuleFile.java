package tech.terrareg.platform.module;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;

/**
 * A file belonging to a module version (README, CHANGELOG...) or to an example.
 *
 * Small files are stored inline in {@code content}; larger ones in blob storage
 * under {@code blobRef}.
 */
@MongoEntity(collection = "module_files")
public class ModuleFile extends PanacheMongoEntityBase {

    public static final int INLINE_LIMIT_BYTES = 256 * 1024;

    @BsonId
    public Long id;

    public Long ownerId;

    public FileOwnerKind ownerKind;

    public String path;

    public byte[] content;

    public String blobRef;

    public String contentType;

    public boolean isInline() {
        return blobRef == null;
    }
}
