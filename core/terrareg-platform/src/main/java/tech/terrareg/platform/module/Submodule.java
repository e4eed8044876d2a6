package tech.terrareg.platform.module;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;

/**
 * A submodule or example directory of a module version.
 *
 * {@code path} is repository-relative with POSIX separators and no leading slash,
 * unique within a version and kind.
 */
@MongoEntity(collection = "submodules")
public class Submodule extends PanacheMongoEntityBase {

    @BsonId
    public Long id;

    public Long moduleVersionId;

    public ComponentKind kind;

    public String path;

    public String readmeText;

    public String terraformDocsJson;

    public String graphJson;

    public String tfsecJson;

    /**
     * Cost estimate output; examples only.
     */
    public String infracostJson;
}
