package io.intellixity.activa.persistence.record;

import io.intellixity.activa.persistence.relation.RelationDescriptor;
import io.intellixity.activa.persistence.relation.UnknownRelationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ModelDescriptorTest {
  @Test
  void defaultsTableAndPrimaryKey() {
    ModelDescriptor m = ModelDescriptor.builder("Tag").field("id", Long.class).build();
    assertEquals("tag", m.table());
    assertEquals("id", m.primaryKey());
    assertNull(m.backendId());
  }

  @Test
  void resolvesFieldsByColumnIgnoringCase() {
    ModelDescriptor post = BlogFixture.models().get("Post");
    assertEquals("userId", post.fieldForColumn("USER_ID").orElseThrow().name());
    assertEquals("user_id", post.field("userId").orElseThrow().column());
    assertTrue(post.fieldForColumn("missing").isEmpty());
  }

  @Test
  void rejectsDuplicateRelationsAndFieldClashes() {
    ModelDescriptor.Builder b = ModelDescriptor.builder("User")
        .relation(RelationDescriptor.hasMany("posts", "Post", "userId"));
    assertThrows(IllegalArgumentException.class, () -> b.relation(RelationDescriptor.hasOne("posts", "Post", "userId")));

    ModelDescriptor.Builder clash = ModelDescriptor.builder("Post")
        .field("user", Long.class)
        .relation(RelationDescriptor.belongsTo("user", "User", "userId"));
    assertThrows(IllegalArgumentException.class, clash::build);
  }

  @Test
  void unknownRelationCarriesModelAndName() {
    ModelDescriptor user = BlogFixture.models().get("User");
    assertTrue(user.hasRelation("posts"));
    UnknownRelationException e = assertThrows(UnknownRelationException.class, () -> user.relation("friends"));
    assertEquals("User", e.model());
    assertEquals("friends", e.relation());
  }

  @Test
  void registryFailsOnUnregisteredTargets() {
    ModelRegistry models = new ModelRegistry().register(ModelDescriptor.builder("User")
        .relation(RelationDescriptor.hasMany("posts", "Post", "userId")).build());
    ModelDescriptor user = models.get("User");
    assertThrows(IllegalArgumentException.class, () -> models.target(user.relation("posts")));
    assertThrows(IllegalArgumentException.class, () -> models.get("Post"));
  }
}
