package io.intellixity.activa.persistence.record;

import io.intellixity.activa.persistence.relation.RelationCacheConfig;
import io.intellixity.activa.persistence.relation.UnknownRelationException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class ActiveRecordTest {
  private final ModelRegistry models = BlogFixture.models();

  private ActiveRecord user(long id) {
    return new ActiveRecord(models.get("User"), Map.of("id", id, "name", "u" + id), RelationCacheConfig.defaults());
  }

  @Test
  void exposesValuesAndPrimaryKey() {
    ActiveRecord u = user(9);
    assertEquals(9L, u.id());
    assertEquals("u9", u.get("name", String.class));
    assertTrue(u.has("name"));
    assertFalse(u.has("age"));
    assertThrows(UnsupportedOperationException.class, () -> u.values().put("age", 1));
  }

  @Test
  void toMapFiltersFields() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("id", 3L);
    values.put("name", "u3");
    values.put("age", 41);
    values.put("active", null);
    ActiveRecord u = new ActiveRecord(models.get("User"), values, RelationCacheConfig.defaults());

    assertEquals(List.of("id", "name", "age", "active"), List.copyOf(u.toMap(null, null).keySet()));
    assertEquals(Map.of("id", 3L, "age", 41), u.toMap(List.of("age", "id", "missing"), null));
    assertEquals(List.of("name", "active"), List.copyOf(u.toMap(Set.of(), Set.of("id", "age")).keySet()));
    assertEquals(Map.of("name", "u3"), u.toMap(Set.of("name", "age"), Set.of("age")));

    u.toMap(null, null).put("id", 99L);
    assertEquals(3L, u.id());
  }

  @Test
  void unloadedRelationIsNotReadable() {
    ActiveRecord u = user(1);
    assertFalse(u.isLoaded("posts"));
    assertThrows(IllegalStateException.class, () -> u.many("posts"));
  }

  @Test
  void loadedNullIsDistinctFromNotLoaded() {
    ActiveRecord post = new ActiveRecord(models.get("Post"), Map.of("id", 1L), RelationCacheConfig.defaults());
    post.relationCache().put("user", null);

    assertTrue(post.isLoaded("user"));
    assertNull(post.one("user"));
  }

  @Test
  void clearingSlots() {
    ActiveRecord u = user(1);
    u.relationCache().put("posts", List.of());
    u.relationCache().put("recentPosts", List.of());

    u.clearRelationCache("recentPosts");
    assertFalse(u.isLoaded("recentPosts"));
    assertThrows(UnknownRelationException.class, () -> u.clearRelationCache("recentPosts"));

    u.clearRelationCache();
    assertFalse(u.isLoaded("posts"));
  }
}
