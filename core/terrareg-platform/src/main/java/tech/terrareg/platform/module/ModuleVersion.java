package tech.terrareg.platform.module;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;

import java.time.Instant;

/**
 * One indexed version of a module provider.
 *
 * Rows are never updated in place on re-ingestion: a new row is inserted and the
 * previous row for the same version is unpublished. At most one row per
 * (moduleProviderId, version) is published.
 */
@MongoEntity(collection = "module_versions")
public class ModuleVersion extends PanacheMongoEntityBase {

    @BsonId
    public Long id;

    public Long moduleProviderId;

    /**
     * SemVer 2.0.0 string.
     */
    public String version;

    /**
     * Numeric components for ordering in queries.
     */
    public int major;
    public int minor;
    public int patch;

    /**
     * True iff the pre-release segment is non-empty.
     */
    public boolean beta;

    /**
     * Gates visibility to Terraform clients.
     */
    public boolean published;

    public Instant publishedAt;

    /**
     * Storage key of the canonical source archive.
     */
    public String sourceArchiveRef;

    /**
     * Storage key of the zip rendition, when generated.
     */
    public String sourceZipRef;

    /**
     * Version of the extraction pipeline that produced this row.
     */
    public int extractionVersion;

    public String readmeText;

    public String description;

    public String owner;

    public String repoSnapshotSha;

    /**
     * Raw terraform-docs JSON for the module root.
     */
    public String terraformDocsJson;

    public String tfsecJson;

    public String graphJson;

    public String variableTemplateJson;

    /**
     * Internal modules are hidden from search unless explicitly requested.
     */
    public boolean internal;

    /**
     * Set once a newer row for the same version has replaced this one.
     */
    public Long supersededById;

    public Instant createdAt = Instant.now();
}
