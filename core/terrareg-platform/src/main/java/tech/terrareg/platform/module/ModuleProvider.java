package tech.terrareg.platform.module;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;

import java.time.Instant;

/**
 * The (namespace, module, provider) triple that versions hang off.
 * The triple is unique.
 */
@MongoEntity(collection = "module_providers")
public class ModuleProvider extends PanacheMongoEntityBase {

    public static final String DEFAULT_GIT_TAG_FORMAT = "{version}";

    @BsonId
    public Long id;

    public Long namespaceId;

    public String moduleName;

    public String providerName;

    /**
     * URL templates accept {namespace}, {module}, {provider}, {tag} and {path}.
     */
    public String repoBaseUrlTemplate;

    public String repoCloneUrlTemplate;

    public String repoBrowseUrlTemplate;

    public String gitTagFormat = DEFAULT_GIT_TAG_FORMAT;

    /**
     * Sub-directory of the repository that holds the module, if not the root.
     */
    public String gitPath;

    public boolean verified = false;

    public Instant createdAt = Instant.now();
}
