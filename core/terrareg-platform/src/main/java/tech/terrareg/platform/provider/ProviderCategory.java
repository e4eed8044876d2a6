package tech.terrareg.platform.provider;

import io.quarkus.mongodb.panache.PanacheMongoEntityBase;
import io.quarkus.mongodb.panache.common.MongoEntity;
import org.bson.codecs.pojo.annotations.BsonId;

@MongoEntity(collection = "provider_categories")
public class ProviderCategory extends PanacheMongoEntityBase {

    @BsonId
    public Long id;

    public String name;

    /**
     * Unique.
     */
    public String slug;

    public boolean userSelectable = true;
}
