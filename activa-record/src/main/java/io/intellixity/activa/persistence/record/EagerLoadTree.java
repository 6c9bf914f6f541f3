package io.intellixity.activa.persistence.record;

import io.intellixity.activa.persistence.plan.InvalidPlanException;
import io.intellixity.activa.persistence.relation.RelationDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Eager-load paths resolved against the model registry. Every node is one batch query.
 *
 * <p>Plain segments are merged by relation name; a customized leaf (modifier or alias) always gets
 * its own node. Two nodes attaching under the same alias at one level are rejected.</p>
 */
final class EagerLoadTree {
  static final class Node {
    final String path;
    final ModelDescriptor owner;
    final RelationDescriptor relation;
    final ModelDescriptor target;
    final String alias;
    final UnaryOperator<ActiveQuery> modifier;
    final boolean plain;
    final List<Node> children = new ArrayList<>();

    Node(String path, ModelDescriptor owner, RelationDescriptor relation, ModelDescriptor target,
         String alias, UnaryOperator<ActiveQuery> modifier, boolean plain) {
      this.path = path;
      this.owner = owner;
      this.relation = relation;
      this.target = target;
      this.alias = alias;
      this.modifier = modifier;
      this.plain = plain;
    }

    List<Node> children() { return Collections.unmodifiableList(children); }
  }

  private final ModelDescriptor root;
  private final List<Node> roots;

  private EagerLoadTree(ModelDescriptor root, List<Node> roots) {
    this.root = root;
    this.roots = roots;
  }

  static EagerLoadTree build(ModelRegistry models, ModelDescriptor root, List<EagerLoad> loads) {
    List<Node> roots = new ArrayList<>();
    for (EagerLoad load : loads) {
      List<String> segments = load.segments();
      List<Node> level = roots;
      ModelDescriptor owner = root;
      String prefix = "";
      for (int i = 0; i < segments.size(); i++) {
        String name = segments.get(i);
        RelationDescriptor relation = owner.relation(name);
        ModelDescriptor target = models.target(relation);
        boolean leaf = i == segments.size() - 1;

        Node node;
        if (!leaf || !load.customized()) {
          node = findPlain(level, name);
          if (node == null) {
            node = new Node(prefix + name, owner, relation, target, name, null, true);
            attach(level, node, prefix);
          }
        } else {
          node = new Node(prefix + load.alias(), owner, relation, target, load.alias(), load.modifier(), false);
          attach(level, node, prefix);
        }
        level = node.children;
        owner = target;
        prefix = node.path + ".";
      }
    }
    return new EagerLoadTree(root, roots);
  }

  ModelDescriptor root() { return root; }

  List<Node> roots() { return Collections.unmodifiableList(roots); }

  boolean isEmpty() { return roots.isEmpty(); }

  int size() {
    return count(roots);
  }

  private static int count(List<Node> nodes) {
    int n = 0;
    for (Node node : nodes) n += 1 + count(node.children);
    return n;
  }

  private static Node findPlain(List<Node> level, String relation) {
    for (Node n : level) {
      if (n.plain && n.relation.name().equals(relation)) return n;
    }
    return null;
  }

  private static void attach(List<Node> level, Node node, String prefix) {
    for (Node n : level) {
      if (n.alias.equals(node.alias)) {
        throw new InvalidPlanException("Eager loads conflict on alias '" + prefix + node.alias + "'");
      }
    }
    level.add(node);
  }
}
