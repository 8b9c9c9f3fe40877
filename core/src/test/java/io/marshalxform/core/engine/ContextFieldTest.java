package io.marshalxform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.marshalxform.core.error.MarshallingException;
import io.marshalxform.core.field.NestedField;
import io.marshalxform.core.field.StringField;
import io.marshalxform.core.model.MarshalResult;
import io.marshalxform.core.schema.Schema;
import io.marshalxform.core.schema.SchemaDefinition;
import io.marshalxform.core.schema.SchemaRegistry;
import io.marshalxform.core.schema.SchemaSettings;
import io.marshalxform.core.testkit.Blog;
import io.marshalxform.core.testkit.CollaboratorSchema;
import io.marshalxform.core.testkit.Schemas;
import io.marshalxform.core.testkit.User;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Method and function fields that depend on the schema context. */
class ContextFieldTest {

    private final Blog blog = Schemas.montysBlog();

    @Test
    void computedFieldsReadTheContext() {
        Schema schema = CollaboratorSchema.DEFINITION.newSchema(
                SchemaSettings.builder().context(Map.of("blog", blog)).build());

        Map<String, Object> owner = schema.dump(blog.getUser()).dataAsMap();
        Map<String, Object> collaborator = schema.dump(blog.getCollaborators().get(0)).dataAsMap();

        assertThat(owner).containsEntry("is_owner", true).containsEntry("is_collab", false);
        assertThat(collaborator).containsEntry("is_owner", false).containsEntry("is_collab", true);
    }

    @Test
    void contextCanBeSetAfterConstruction() {
        Schema schema = CollaboratorSchema.DEFINITION.newSchema();
        schema.setContext(Map.of("blog", blog));

        assertThat(schema.dump(blog.getUser()).dataAsMap()).containsEntry("is_owner", true);
    }

    @Test
    void missingContextIsAFieldError() {
        MarshalResult result = CollaboratorSchema.DEFINITION.newSchema().dump(new User("Joe"));

        assertThat(result.messages("is_owner")).containsExactly("No context available for Method field 'is_owner'");
        assertThat(result.messages("is_collab"))
                .containsExactly("No context available for Function field 'is_collab'");
        assertThat(result.dataAsMap()).containsOnlyKeys("name");
    }

    @Test
    void nullContextCountsAsMissing() {
        Schema schema = CollaboratorSchema.DEFINITION.newSchema();
        schema.setContext(null);

        assertThat(schema.dump(new User("Joe")).errors()).containsOnlyKeys("is_owner", "is_collab");
    }

    @Test
    void strictSchemaRaisesWithoutContext() {
        Schema schema = CollaboratorSchema.DEFINITION.newSchema(SchemaSettings.builder().strict(true).build());

        assertThatThrownBy(() -> schema.dump(new User("Joe")))
                .isInstanceOf(MarshallingException.class)
                .hasMessage("Error dumping field 'is_owner': No context available for Method field 'is_owner'");
    }

    @Test
    void nestedSchemasShareTheParentContext() {
        SchemaDefinition blogSchema = SchemaDefinition.builder("ContextBlog")
                .registry(new SchemaRegistry())
                .field("title", new StringField())
                .field("user", new NestedField(CollaboratorSchema.DEFINITION))
                .field("collaborators", new NestedField(CollaboratorSchema.DEFINITION).many())
                .build();
        Schema schema = blogSchema.newSchema();
        schema.setContext(Map.of("blog", blog));

        MarshalResult result = schema.dump(blog);

        assertThat(result.hasErrors()).isFalse();
        assertThat(((Map<?, ?>) result.dataAsMap().get("user")).get("is_owner")).isEqualTo(true);
        assertThat((List<?>) result.dataAsMap().get("collaborators"))
                .allSatisfy(c -> assertThat(((Map<?, ?>) c).get("is_collab")).isEqualTo(true));
    }
}
