package tech.terrareg.platform.provider;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;

/**
 * Platform-specific zip of a provider release. Unique per (providerVersionId, os, arch).
 */
@MongoEntity(collection = "provider_version_binaries")
public class ProviderVersionBinary extends PanacheMongoEntityBase {

    @BsonId
    public Long id;

    public Long providerVersionId;

    public String os;

    public String arch;

    /**
     * terraform-provider-&lt;name&gt;_&lt;version&gt;_&lt;os&gt;_&lt;arch&gt;.zip
     */
    public String filename;

    public String sha256;

    public long size;

    public String blobRef;
}
