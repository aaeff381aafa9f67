package io.intellixity.polystore.adapter.vector;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.ReplaceOptions;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MongoDB Atlas Vector Search backend using the official sync driver.\n
 *
 * Documents are stored as {@code {_id, embedding, metadata, text}}. Queries run a {@code $vectorSearch}
 * stage against {@code searchIndex}; metadata filters are pushed into the stage as
 * {@code metadata.<field>} equality, so those fields must be declared as filter fields in the index.
 * {@code vectorSearchScore} is already a similarity.\n
 */
public final class MongoVectorIndexBackend implements VectorIndexBackend {
  private static final Logger log = LoggerFactory.getLogger(MongoVectorIndexBackend.class);

  public record Config(String uri, String database, String collection, String searchIndex, int numCandidatesFactor) {
    public Config {
      Objects.requireNonNull(uri, "uri");
      Objects.requireNonNull(database, "database");
      Objects.requireNonNull(collection, "collection");
      Objects.requireNonNull(searchIndex, "searchIndex");
      if (numCandidatesFactor < 1) numCandidatesFactor = 1;
    }
  }

  private final Config config;
  private volatile MongoClient client;
  private volatile MongoCollection<Document> coll;

  public MongoVectorIndexBackend(Config config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  @Override
  public void open() {
    MongoClient c = MongoClients.create(config.uri());
    try {
      MongoDatabase db = c.getDatabase(config.database());
      db.runCommand(new Document("ping", 1));
      this.coll = db.getCollection(config.collection());
      this.client = c;
    } catch (RuntimeException e) {
      c.close();
      throw e;
    }
  }

  @Override
  public void close() {
    MongoClient c = client;
    client = null;
    coll = null;
    if (c != null) c.close();
  }

  @Override
  public void ping() {
    live().getDatabase(config.database()).runCommand(new Document("ping", 1));
  }

  @Override
  public void upsert(VectorRecord r) {
    Document doc = new Document("_id", r.id())
        .append("embedding", toDoubles(r.embedding()))
        .append("metadata", new Document(r.metadata()))
        .append("text", r.text());
    collection().replaceOne(Filters.eq("_id", r.id()), doc, new ReplaceOptions().upsert(true));
  }

  @Override
  public List<VectorHit> search(float[] query, int topK, Map<String, Object> filter) {
    Document stage = new Document("index", config.searchIndex())
        .append("path", "embedding")
        .append("queryVector", toDoubles(query))
        .append("numCandidates", Math.max(topK, topK * config.numCandidatesFactor()))
        .append("limit", topK);
    if (filter != null && !filter.isEmpty()) stage.append("filter", toFilter(filter));

    List<Bson> pipeline = List.of(
        new Document("$vectorSearch", stage),
        new Document("$project", new Document("_id", 1)
            .append("metadata", 1)
            .append("text", 1)
            .append("score", new Document("$meta", "vectorSearchScore"))));

    if (log.isDebugEnabled()) {
      log.debug("polystore.vector op=vectorSearch collection={} index={} topK={} filterKeys={}",
          config.collection(), config.searchIndex(), topK, filter == null ? 0 : filter.size());
    }

    List<VectorHit> out = new ArrayList<>();
    for (Document d : collection().aggregate(pipeline)) {
      Document md = d.get("metadata", Document.class);
      Map<String, Object> metadata = (md == null) ? Map.of() : new LinkedHashMap<>(md);
      Number score = d.get("score", Number.class);
      out.add(new VectorHit(String.valueOf(d.get("_id")), score == null ? 0.0 : score.doubleValue(),
          ScoreKind.SIMILARITY, metadata, d.getString("text")));
    }
    return out;
  }

  @Override
  public long count() {
    return collection().countDocuments();
  }

  private static Document toFilter(Map<String, Object> filter) {
    List<Document> clauses = new ArrayList<>();
    for (var e : filter.entrySet()) {
      clauses.add(new Document("metadata." + e.getKey(), new Document("$eq", e.getValue())));
    }
    return clauses.size() == 1 ? clauses.get(0) : new Document("$and", clauses);
  }

  private static List<Double> toDoubles(float[] v) {
    List<Double> out = new ArrayList<>(v.length);
    for (float x : v) out.add((double) x);
    return out;
  }

  private MongoClient live() {
    MongoClient c = client;
    if (c == null) throw new IllegalStateException("Mongo backend is not open");
    return c;
  }

  private MongoCollection<Document> collection() {
    MongoCollection<Document> c = coll;
    if (c == null) throw new IllegalStateException("Mongo backend is not open");
    return c;
  }
}
