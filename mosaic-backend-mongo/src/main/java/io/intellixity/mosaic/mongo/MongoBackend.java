package io.intellixity.mosaic.mongo;

import com.mongodb.MongoBulkWriteException;
import com.mongodb.MongoNamespace;
import com.mongodb.bulk.BulkWriteError;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.InsertManyOptions;
import io.intellixity.mosaic.fs.*;
import io.intellixity.mosaic.path.DirPath;
import io.intellixity.mosaic.path.FilePath;
import io.intellixity.mosaic.path.Path;
import io.intellixity.mosaic.spi.FileSystemBackend;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * {@link FileSystemBackend} over a MongoDB deployment using the official sync driver.
 * <p>
 * Files are collections and rows are documents; see {@link MongoPaths} for the mapping. Reads stream through a
 * driver cursor. Writes are unordered bulk inserts, so one rejected document does not stop the rest.
 */
public final class MongoBackend implements FileSystemBackend {
  private static final Logger log = LoggerFactory.getLogger(MongoBackend.class);

  private final MongoClient client;
  private final MongoPaths paths;

  public MongoBackend(MongoClient client, MongoPaths paths) {
    this.client = Objects.requireNonNull(client, "client");
    this.paths = Objects.requireNonNull(paths, "paths");
  }

  @Override
  public RowCursor read(FilePath file) {
    MongoPaths.CollectionRef c = existing(file);
    MongoCursor<Document> it = client.getDatabase(c.database()).getCollection(c.name()).find().iterator();
    return RowCursor.fromIterator(new Iterator<>() {
      @Override public boolean hasNext() { return it.hasNext(); }
      @Override public Row next() { return Row.of(it.next()); }
    }, it::close);
  }

  @Override
  public WriteResult write(FilePath file, List<Row> rows) {
    MongoPaths.CollectionRef c = paths.collection(file);
    MongoDatabase db = client.getDatabase(c.database());
    db.getCollection(c.name()).drop();
    db.createCollection(c.name());
    return insert(file, c, rows);
  }

  @Override
  public WriteResult append(FilePath file, List<Row> rows) {
    MongoPaths.CollectionRef c = paths.collection(file);
    MongoDatabase db = client.getDatabase(c.database());
    if (!collectionNames(db).contains(c.name())) db.createCollection(c.name());
    return insert(file, c, rows);
  }

  @Override
  public void delete(Path path) {
    if (path instanceof FilePath file) {
      MongoPaths.CollectionRef c = existing(file);
      client.getDatabase(c.database()).getCollection(c.name()).drop();
      log.debug("mosaic.mongo op=drop db={} collection={}", c.database(), c.name());
      return;
    }

    MongoPaths.Prefix p = paths.prefix((DirPath) path);
    if (p.isServerRoot()) {
      for (String db : databaseNames()) client.getDatabase(db).drop();
      return;
    }
    MongoDatabase db = client.getDatabase(p.database());
    if (p.prefix().isEmpty()) {
      if (paths.database().isEmpty() && !databaseNames().contains(p.database())) throw FileSystemException.pathNotFound(path);
      db.drop();
      return;
    }
    List<String> doomed = matching(db, p);
    if (doomed.isEmpty()) throw FileSystemException.pathNotFound(path);
    for (String name : doomed) db.getCollection(name).drop();
  }

  @Override
  public Set<Node> list(DirPath dir) {
    MongoPaths.Prefix p = paths.prefix(dir);
    if (p.isServerRoot()) {
      Set<Node> out = new LinkedHashSet<>();
      for (String db : databaseNames()) out.add(Node.dir(db));
      return out;
    }
    if (paths.database().isEmpty() && !databaseNames().contains(p.database())) throw FileSystemException.pathNotFound(dir);
    Set<Node> out = paths.children(p, collectionNames(client.getDatabase(p.database())));
    if (out.isEmpty() && !p.prefix().isEmpty()) throw FileSystemException.pathNotFound(dir);
    return out;
  }

  @Override
  public void move(Path src, Path dst) {
    if (src instanceof FilePath from) {
      MongoPaths.CollectionRef s = existing(from);
      MongoPaths.CollectionRef d = paths.collection((FilePath) dst);
      sameDatabase(src, dst, s.database(), d.database());
      rename(s, d.name());
      return;
    }

    MongoPaths.Prefix s = paths.prefix((DirPath) src);
    MongoPaths.Prefix d = paths.prefix((DirPath) dst);
    if (s.isServerRoot() || d.isServerRoot() || s.prefix().isEmpty() || d.prefix().isEmpty()) {
      throw new FileSystemException(FsError.BACKEND_ERROR, "Databases cannot be moved: " + src + " -> " + dst, src);
    }
    sameDatabase(src, dst, s.database(), d.database());
    if (d.prefix().startsWith(s.prefix())) throw new IllegalArgumentException("Cannot move " + src + " into itself: " + dst);

    List<String> moving = matching(client.getDatabase(s.database()), s);
    if (moving.isEmpty()) throw FileSystemException.pathNotFound(src);
    for (String name : moving) {
      rename(new MongoPaths.CollectionRef(s.database(), name), d.prefix() + name.substring(s.prefix().length()));
    }
  }

  @Override
  public void close() {
    client.close();
  }

  private WriteResult insert(FilePath file, MongoPaths.CollectionRef c, List<Row> rows) {
    Objects.requireNonNull(rows, "rows");
    List<FileSystemException> errors = new ArrayList<>();
    List<Document> docs = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      Row r = rows.get(i);
      if (r == null) errors.add(recordError(file, i, "null record"));
      else docs.add(new Document(r.values()));
    }
    if (docs.isEmpty()) return new WriteResult(0, errors);

    try {
      client.getDatabase(c.database()).getCollection(c.name()).insertMany(docs, new InsertManyOptions().ordered(false));
      log.debug("mosaic.mongo op=insert db={} collection={} n={}", c.database(), c.name(), docs.size());
      return new WriteResult(docs.size(), errors);
    } catch (MongoBulkWriteException e) {
      for (BulkWriteError err : e.getWriteErrors()) errors.add(recordError(file, err.getIndex(), err.getMessage()));
      return new WriteResult(e.getWriteResult().getInsertedCount(), errors);
    }
  }

  private static FileSystemException recordError(FilePath file, int index, String message) {
    return new FileSystemException(FsError.BACKEND_ERROR, "Record " + index + " rejected for " + file + ": " + message, file);
  }

  private MongoPaths.CollectionRef existing(FilePath file) {
    MongoPaths.CollectionRef c = paths.collection(file);
    if (!collectionNames(client.getDatabase(c.database())).contains(c.name())) throw FileSystemException.pathNotFound(file);
    return c;
  }

  private void rename(MongoPaths.CollectionRef from, String to) {
    client.getDatabase(from.database()).getCollection(from.name()).renameCollection(new MongoNamespace(from.database(), to));
    log.debug("mosaic.mongo op=rename db={} from={} to={}", from.database(), from.name(), to);
  }

  private static void sameDatabase(Path src, Path dst, String a, String b) {
    if (!a.equals(b)) {
      throw new FileSystemException(FsError.BACKEND_ERROR, "Cannot move across databases: " + src + " -> " + dst, src);
    }
  }

  private List<String> matching(MongoDatabase db, MongoPaths.Prefix p) {
    List<String> out = new ArrayList<>();
    for (String name : collectionNames(db)) {
      if (!name.startsWith("system.") && p.matches(name)) out.add(name);
    }
    return out;
  }

  private List<String> databaseNames() {
    List<String> out = new ArrayList<>();
    for (String db : client.listDatabaseNames()) {
      if (!MongoPaths.SYSTEM_DATABASES.contains(db)) out.add(db);
    }
    return out;
  }

  private static Set<String> collectionNames(MongoDatabase db) {
    return db.listCollectionNames().into(new HashSet<>());
  }
}
