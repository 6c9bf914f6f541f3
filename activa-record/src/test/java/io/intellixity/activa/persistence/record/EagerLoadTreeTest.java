package io.intellixity.activa.persistence.record;

import io.intellixity.activa.persistence.plan.InvalidPlanException;
import io.intellixity.activa.persistence.relation.UnknownRelationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class EagerLoadTreeTest {
  private final ModelRegistry models = BlogFixture.models();
  private final ModelDescriptor user = models.get("User");

  @Test
  void sharedPrefixesMergeIntoOneNode() {
    EagerLoadTree tree = EagerLoadTree.build(models, user,
        List.of(EagerLoad.of("posts"), EagerLoad.of("posts.comments"), EagerLoad.of("posts.user")));

    assertEquals(3, tree.size());
    assertEquals(1, tree.roots().size());
    EagerLoadTree.Node posts = tree.roots().get(0);
    assertEquals("posts", posts.path);
    assertEquals("Post", posts.target.name());
    assertEquals(List.of("posts.comments", "posts.user"),
        posts.children().stream().map(n -> n.path).toList());
  }

  @Test
  void customizedLeafGetsItsOwnNode() {
    EagerLoadTree tree = EagerLoadTree.build(models, user, List.of(
        EagerLoad.of("posts.comments"),
        EagerLoad.of("posts.comments", q -> q.limit(1)).as("firstComment")));

    assertEquals(3, tree.size());
    EagerLoadTree.Node posts = tree.roots().get(0);
    assertEquals(2, posts.children().size());
    EagerLoadTree.Node custom = posts.children().get(1);
    assertFalse(custom.plain);
    assertEquals("firstComment", custom.alias);
    assertEquals("posts.firstComment", custom.path);
    assertNotNull(custom.modifier);
  }

  @Test
  void sameAliasTwiceAtOneLevelIsRejected() {
    InvalidPlanException e = assertThrows(InvalidPlanException.class, () -> EagerLoadTree.build(models, user,
        List.of(EagerLoad.of("posts.comments"), EagerLoad.of("posts.user").as("comments"))));
    assertTrue(e.getMessage().contains("posts.comments"));
  }

  @Test
  void unknownSegmentNamesTheOwningModel() {
    UnknownRelationException e = assertThrows(UnknownRelationException.class,
        () -> EagerLoadTree.build(models, user, List.of(EagerLoad.of("posts.tags"))));
    assertEquals("Post", e.model());
    assertEquals("tags", e.relation());
  }

  @Test
  void emptyLoadListBuildsAnEmptyTree() {
    EagerLoadTree tree = EagerLoadTree.build(models, user, List.of());
    assertTrue(tree.isEmpty());
    assertEquals(0, tree.size());
    assertSame(user, tree.root());
  }

  @Test
  void eagerLoadPathValidation() {
    assertThrows(IllegalArgumentException.class, () -> EagerLoad.of("posts..comments"));
    assertThrows(IllegalArgumentException.class, () -> EagerLoad.of("posts."));

    EagerLoad load = EagerLoad.of("posts.comments");
    assertEquals(List.of("posts", "comments"), load.segments());
    assertEquals("comments", load.alias());
    assertFalse(load.customized());
    assertTrue(load.as("recent").customized());
  }
}
