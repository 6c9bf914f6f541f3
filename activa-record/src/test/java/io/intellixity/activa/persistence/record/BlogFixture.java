package io.intellixity.activa.persistence.record;

import io.intellixity.activa.persistence.jdbc.JdbcBackends;
import io.intellixity.activa.persistence.jdbc.JdbcQueryExecutor;
import io.intellixity.activa.persistence.relation.RelationDescriptor;
import io.intellixity.activa.persistence.spi.exec.Backend;
import io.intellixity.activa.persistence.spi.sql.SqlStatement;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * File-backed SQLite blog schema shared by the record tests.
 *
 * <p>Users 1..{@value #USERS}; every user whose id is not a multiple of 5 has two posts with three
 * comments each. Two orphan posts have no user. Nodes 1..5 form a cycle; categories 1..8 form a
 * five-level tree. Notes live on a second backend.</p>
 */
final class BlogFixture implements AutoCloseable {
  static final int USERS = 1000;
  static final int ORPHAN_POSTS = 2;

  final ExecutorService pool;
  final Backend main;
  final Backend archive;
  final ActivaContext ctx;
  final List<String> statements = Collections.synchronizedList(new ArrayList<>());

  BlogFixture(Path dir) {
    pool = Executors.newSingleThreadExecutor();
    main = JdbcBackends.detect("main", dataSource(dir.resolve("blog.db")), pool, false);
    archive = JdbcBackends.detect("archive", dataSource(dir.resolve("archive.db")));
    createSchema();
    seed();
    ((JdbcQueryExecutor) main.executor()).addListener((backendId, st) -> statements.add(st.sql()));
    ((JdbcQueryExecutor) archive.executor()).addListener((backendId, st) -> statements.add(st.sql()));
    ctx = new ActivaContext(models()).register(main).register(archive);
  }

  static int ageOf(int userId) { return 20 + userId % 30; }
  static boolean activeOf(int userId) { return userId % 2 == 0; }
  static boolean hasPosts(int userId) { return userId % 5 != 0; }

  static ModelRegistry models() {
    return new ModelRegistry()
        .register(ModelDescriptor.builder("User").table("users")
            .field("id", Long.class)
            .field("name", String.class)
            .field("age", Integer.class)
            .field("active", Boolean.class)
            .relation(RelationDescriptor.hasMany("posts", "Post", "userId").withInverseOf("user"))
            .relation(RelationDescriptor.hasMany("notes", "Note", "userId"))
            .build())
        .register(ModelDescriptor.builder("Post").table("posts")
            .field("id", Long.class)
            .field(FieldDef.of("userId", Long.class).column("user_id"))
            .field("title", String.class)
            .relation(RelationDescriptor.belongsTo("user", "User", "userId"))
            .relation(RelationDescriptor.hasMany("comments", "Comment", "postId"))
            .build())
        .register(ModelDescriptor.builder("Comment").table("comments")
            .field("id", Long.class)
            .field(FieldDef.of("postId", Long.class).column("post_id"))
            .field("body", String.class)
            .relation(RelationDescriptor.belongsTo("post", "Post", "postId"))
            .build())
        .register(ModelDescriptor.builder("Node").table("nodes")
            .field("id", Long.class)
            .field(FieldDef.of("nextId", Long.class).column("next_id"))
            .build())
        .register(ModelDescriptor.builder("Category").table("categories")
            .field("id", Long.class)
            .field(FieldDef.of("parentId", Long.class).column("parent_id"))
            .field("name", String.class)
            .build())
        .register(ModelDescriptor.builder("Note").table("notes").backend("archive")
            .field("id", Long.class)
            .field(FieldDef.of("userId", Long.class).column("user_id"))
            .field("body", String.class)
            .build());
  }

  void resetStatements() {
    statements.clear();
  }

  List<String> statementsMatching(String fragment) {
    List<String> out = new ArrayList<>();
    synchronized (statements) {
      for (String s : statements) {
        if (s.contains(fragment)) out.add(s);
      }
    }
    return out;
  }

  private static SQLiteDataSource dataSource(Path file) {
    SQLiteDataSource ds = new SQLiteDataSource();
    ds.setUrl("jdbc:sqlite:" + file);
    return ds;
  }

  private void createSchema() {
    exec(main, "CREATE TABLE users (id INTEGER PRIMARY KEY, name TEXT NOT NULL, age INTEGER, active INTEGER)");
    exec(main, "CREATE TABLE posts (id INTEGER PRIMARY KEY, user_id INTEGER, title TEXT)");
    exec(main, "CREATE TABLE comments (id INTEGER PRIMARY KEY, post_id INTEGER NOT NULL, body TEXT)");
    exec(main, "CREATE TABLE nodes (id INTEGER PRIMARY KEY, next_id INTEGER)");
    exec(main, "CREATE TABLE categories (id INTEGER PRIMARY KEY, parent_id INTEGER, name TEXT NOT NULL)");
    exec(archive, "CREATE TABLE notes (id INTEGER PRIMARY KEY, user_id INTEGER, body TEXT)");
  }

  private void seed() {
    List<String> users = new ArrayList<>();
    List<String> posts = new ArrayList<>();
    List<String> comments = new ArrayList<>();
    int postId = 0;
    int commentId = 0;
    for (int u = 1; u <= USERS; u++) {
      users.add("(" + u + ", 'user" + u + "', " + ageOf(u) + ", " + (activeOf(u) ? 1 : 0) + ")");
      if (!hasPosts(u)) continue;
      for (int p = 0; p < 2; p++) {
        postId++;
        posts.add("(" + postId + ", " + u + ", 'post" + postId + "')");
        for (int c = 0; c < 3; c++) {
          commentId++;
          comments.add("(" + commentId + ", " + postId + ", 'comment" + commentId + "')");
        }
      }
    }
    for (int o = 0; o < ORPHAN_POSTS; o++) {
      postId++;
      posts.add("(" + postId + ", NULL, 'orphan" + postId + "')");
    }
    insertRows(main, "users (id, name, age, active)", users);
    insertRows(main, "posts (id, user_id, title)", posts);
    insertRows(main, "comments (id, post_id, body)", comments);
    insertRows(main, "nodes (id, next_id)", List.of("(1, 2)", "(2, 3)", "(3, 4)", "(4, 5)", "(5, 1)"));
    // 1 > (2 > (4 > 7 > 8, 5), 3 > 6)
    insertRows(main, "categories (id, parent_id, name)", List.of("(1, NULL, 'root')", "(2, 1, 'books')",
        "(3, 1, 'music')", "(4, 2, 'fiction')", "(5, 2, 'poetry')", "(6, 3, 'jazz')", "(7, 4, 'crime')",
        "(8, 7, 'noir')"));
    insertRows(archive, "notes (id, user_id, body)", List.of("(1, 1, 'a')", "(2, 1, 'b')", "(3, 2, 'c')"));
  }

  private static void insertRows(Backend backend, String target, List<String> rows) {
    for (int from = 0; from < rows.size(); from += 200) {
      StringJoiner values = new StringJoiner(", ");
      for (String r : rows.subList(from, Math.min(rows.size(), from + 200))) values.add(r);
      exec(backend, "INSERT INTO " + target + " VALUES " + values);
    }
  }

  private static void exec(Backend backend, String sql) {
    backend.executor().update(new SqlStatement(sql, List.of(), SqlStatement.ExecKind.UPDATE));
  }

  @Override
  public void close() {
    pool.shutdownNow();
  }
}
