package io.intellixity.activa.persistence.relation;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class RelationCacheTest {
  private final AtomicLong clock = new AtomicLong(1_000L);

  @Test
  void loadedNullIsDistinctFromNotLoaded() {
    RelationCache cache = new RelationCache(RelationCacheConfig.defaults(), clock::get);
    assertSame(RelationSlot.NOT_LOADED, cache.get("author"));
    cache.put("author", null);
    RelationSlot slot = cache.get("author");
    assertTrue(slot.loaded());
    assertNull(slot.value());
  }

  @Test
  void entriesExpireAfterDefaultTtl() {
    RelationCache cache = new RelationCache(new RelationCacheConfig(true, Duration.ofSeconds(10)), clock::get);
    cache.put("posts", List.of());
    clock.addAndGet(9_999L);
    assertTrue(cache.isLoaded("posts"));
    clock.addAndGet(1L);
    assertFalse(cache.isLoaded("posts"));
  }

  @Test
  void relationTtlOverridesDefault() {
    RelationCache cache = new RelationCache(new RelationCacheConfig(true, Duration.ofSeconds(10)), clock::get);
    cache.put("posts", List.of(), Duration.ofSeconds(1));
    cache.put("comments", List.of(), Duration.ZERO);
    clock.addAndGet(5_000L);
    assertFalse(cache.isLoaded("posts"));
    clock.addAndGet(1_000_000_000L);
    assertTrue(cache.isLoaded("comments"));
  }

  @Test
  void disabledExpiryKeepsEntriesUntilCleared() {
    RelationCache cache = new RelationCache(RelationCacheConfig.noExpiry(), clock::get);
    cache.put("posts", List.of(), Duration.ofMillis(1));
    clock.addAndGet(60_000L);
    assertTrue(cache.isLoaded("posts"));
    cache.clear("posts");
    assertFalse(cache.isLoaded("posts"));
  }

  @Test
  void loadedNamesDropsExpiredAndClearAllEmpties() {
    RelationCache cache = new RelationCache(new RelationCacheConfig(true, Duration.ofSeconds(1)), clock::get);
    cache.put("a", 1);
    cache.put("b", 2, Duration.ofSeconds(60));
    clock.addAndGet(2_000L);
    assertEquals(Set.of("b"), cache.loadedNames());
    cache.clearAll();
    assertTrue(cache.loadedNames().isEmpty());
  }

  @Test
  void descriptorKeysFollowKind() {
    RelationDescriptor posts = RelationDescriptor.hasMany("posts", "Post", "user_id");
    assertEquals("id", posts.parentKey());
    assertEquals("user_id", posts.childKey());
    assertTrue(posts.many());

    RelationDescriptor author = RelationDescriptor.belongsTo("author", "User", "user_id");
    assertEquals("user_id", author.parentKey());
    assertEquals("id", author.childKey());
    assertFalse(author.many());

    assertThrows(IllegalArgumentException.class,
        () -> new RelationDescriptor("c", RelationKind.POLYMORPHIC, "Comment", null, "commentable_id", null, null, null, null));
    assertThrows(IllegalArgumentException.class, () -> posts.withCacheTtl(Duration.ofSeconds(-1)));
  }
}
