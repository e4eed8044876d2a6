package tech.terrareg.platform.config;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.bson.Document;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Creates MongoDB indexes on application startup.
 *
 * The unique indexes back the uniqueness rules that services rely on when they
 * translate duplicate-key errors into conflicts.
 */
@ApplicationScoped
public class MongoIndexInitializer {

    private static final Logger LOG = Logger.getLogger(MongoIndexInitializer.class);

    @Inject
    MongoClient mongoClient;

    @ConfigProperty(name = "quarkus.mongodb.database")
    String databaseName;

    void onStart(@Observes StartupEvent ev) {
        LOG.info("Initializing MongoDB indexes...");
        MongoDatabase db = mongoClient.getDatabase(databaseName);

        createNamespaceIndexes(db);
        createModuleIndexes(db);
        createProviderIndexes(db);
        createAuthIndexes(db);
        createAnalyticsIndexes(db);

        LOG.info("MongoDB indexes initialized successfully");
    }

    private void createNamespaceIndexes(MongoDatabase db) {
        MongoCollection<Document> namespaces = db.getCollection("namespaces");
        namespaces.createIndex(Indexes.ascending("nameLower"), opt().unique(true));
    }

    private void createModuleIndexes(MongoDatabase db) {
        MongoCollection<Document> moduleProviders = db.getCollection("module_providers");
        moduleProviders.createIndex(
            Indexes.compoundIndex(Indexes.ascending("namespaceId"), Indexes.ascending("moduleName"),
                Indexes.ascending("providerName")),
            opt().unique(true));

        MongoCollection<Document> moduleVersions = db.getCollection("module_versions");
        moduleVersions.createIndex(
            Indexes.compoundIndex(Indexes.ascending("moduleProviderId"), Indexes.ascending("version")), opt());
        moduleVersions.createIndex(
            Indexes.compoundIndex(Indexes.ascending("published"), Indexes.descending("publishedAt")), opt());

        MongoCollection<Document> submodules = db.getCollection("submodules");
        submodules.createIndex(
            Indexes.compoundIndex(Indexes.ascending("moduleVersionId"), Indexes.ascending("kind"),
                Indexes.ascending("path")),
            opt().unique(true));

        MongoCollection<Document> files = db.getCollection("module_files");
        files.createIndex(
            Indexes.compoundIndex(Indexes.ascending("ownerId"), Indexes.ascending("ownerKind"),
                Indexes.ascending("path")),
            opt().unique(true));
    }

    private void createProviderIndexes(MongoDatabase db) {
        MongoCollection<Document> providers = db.getCollection("providers");
        providers.createIndex(
            Indexes.compoundIndex(Indexes.ascending("namespaceId"), Indexes.ascending("name")), opt().unique(true));

        MongoCollection<Document> versions = db.getCollection("provider_versions");
        versions.createIndex(
            Indexes.compoundIndex(Indexes.ascending("providerId"), Indexes.ascending("version")), opt().unique(true));

        MongoCollection<Document> binaries = db.getCollection("provider_version_binaries");
        binaries.createIndex(
            Indexes.compoundIndex(Indexes.ascending("providerVersionId"), Indexes.ascending("os"),
                Indexes.ascending("arch")),
            opt().unique(true));

        MongoCollection<Document> categories = db.getCollection("provider_categories");
        categories.createIndex(Indexes.ascending("slug"), opt().unique(true));

        MongoCollection<Document> gpgKeys = db.getCollection("gpg_keys");
        gpgKeys.createIndex(Indexes.ascending("fingerprint"), opt().unique(true));
        gpgKeys.createIndex(
            Indexes.compoundIndex(Indexes.ascending("namespaceId"), Indexes.ascending("keyId")), opt());
    }

    private void createAuthIndexes(MongoDatabase db) {
        MongoCollection<Document> sessions = db.getCollection("sessions");
        sessions.createIndex(
            Indexes.compoundIndex(Indexes.ascending("kind"), Indexes.ascending("expiry")), opt());

        MongoCollection<Document> userGroups = db.getCollection("user_groups");
        userGroups.createIndex(Indexes.ascending("name"), opt().unique(true));

        MongoCollection<Document> permissions = db.getCollection("user_group_namespace_permissions");
        permissions.createIndex(
            Indexes.compoundIndex(Indexes.ascending("userGroupId"), Indexes.ascending("namespaceId")),
            opt().unique(true));
        permissions.createIndex(Indexes.ascending("namespaceId"), opt());

        MongoCollection<Document> codes = db.getCollection("terraform_idp_authorization_codes");
        codes.createIndex(Indexes.ascending("codeHash"), opt().unique(true));
        codes.createIndex(Indexes.ascending("expiry"), opt());

        MongoCollection<Document> tokens = db.getCollection("terraform_idp_access_tokens");
        tokens.createIndex(Indexes.ascending("tokenHash"), opt().unique(true));
        tokens.createIndex(Indexes.ascending("expiry"), opt());
    }

    private void createAnalyticsIndexes(MongoDatabase db) {
        MongoCollection<Document> analytics = db.getCollection("analytics");
        analytics.createIndex(Indexes.ascending("moduleVersionId"), opt());
        analytics.createIndex(
            Indexes.compoundIndex(Indexes.ascending("moduleProviderId"), Indexes.descending("timestamp")), opt());
    }

    private IndexOptions opt() {
        return new IndexOptions().background(true);
    }
}
