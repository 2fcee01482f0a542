package com.jsearch.examples;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jsearch.common.io.AtomicFiles;
import com.jsearch.common.schema.FieldType;
import com.jsearch.common.schema.Schema;
import com.jsearch.index.IndexConfig;
import com.jsearch.index.SearchIndex;
import com.jsearch.query.SearchHit;
import com.jsearch.query.SearchResults;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Example application that indexes a small movie catalogue and runs one query
 * of every kind against it.
 */
public class MovieSearchExample implements AutoCloseable {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final Object[][] MOVIES = {
        {"tt0111161", "The Shawshank Redemption", 1994L, 9.3},
        {"tt0068646", "The Godfather", 1972L, 9.2},
        {"tt0468569", "The Dark Knight", 2008L, 9.0},
        {"tt0108052", "Schindler's List", 1993L, 9.0},
        {"tt0167260", "The Lord of the Rings: The Return of the King", 2003L, 9.0},
        {"tt0137523", "Fight Club", 1999L, 8.8},
        {"tt0109830", "Forrest Gump", 1994L, 8.8},
        {"tt0120737", "The Lord of the Rings: The Fellowship of the Ring", 2001L, 8.8},
        {"tt0080684", "Star Wars: Episode V - The Empire Strikes Back", 1980L, 8.7},
        {"tt0133093", "The Matrix", 1999L, 8.7},
    };

    private final Path indexPath;
    private SearchIndex index;

    /**
     * Creates a fresh movie index, replacing anything at {@code indexPath}.
     *
     * @param indexPath Directory for the index
     * @throws IOException If the index cannot be created
     */
    public MovieSearchExample(Path indexPath) throws IOException {
        this.indexPath = indexPath;
        AtomicFiles.deleteRecursively(indexPath);
        this.index = SearchIndex.create(indexPath, movieSchema(), IndexConfig.defaults());
    }

    static Schema movieSchema() {
        return new Schema.Builder()
            .addField("id", FieldType.TEXT, true, true, false, "raw")
            .addTextField("title", true)
            .addField("year", FieldType.I64, true, true, true, "default")
            .addField("rating", FieldType.F64, true, true, true, "default")
            .addSearchField("title")
            .build();
    }

    /**
     * Adds every movie and commits.
     *
     * @return The number of searchable movies
     */
    public long indexMovies() throws IOException {
        for (Object[] movie : MOVIES) {
            ObjectNode doc = MAPPER.createObjectNode();
            doc.put("id", (String) movie[0]);
            doc.put("title", (String) movie[1]);
            doc.put("year", (Long) movie[2]);
            doc.put("rating", (Double) movie[3]);
            index.addDocument(MAPPER.writeValueAsString(doc));
        }
        return index.commit();
    }

    public SearchResults text(String query, int limit) throws IOException {
        return run(query("text").put("query", query).put("limit", limit));
    }

    public SearchResults fuzzy(String term, int distance, int limit) throws IOException {
        return run(query("fuzzy").put("term", term).put("distance", distance).put("limit", limit));
    }

    public SearchResults phrase(String phrase, int limit) throws IOException {
        return run(query("phrase").put("phrase", phrase).put("limit", limit));
    }

    public SearchResults prefix(String prefix, int limit) throws IOException {
        return run(query("prefix").put("prefix", prefix).put("limit", limit));
    }

    public SearchResults termMatch(String field, String value, int limit) throws IOException {
        return run(query("term_match").put("field", field).put("value", value).put("limit", limit));
    }

    public SearchResults yearRange(long min, long max, int limit) throws IOException {
        return run(query("range_i64").put("field", "year").put("min", min).put("max", max).put("limit", limit));
    }

    public SearchResults minRating(double min, int limit) throws IOException {
        return run(query("range_f64").put("field", "rating").put("min", min).put("limit", limit));
    }

    /**
     * Titles containing {@code word} released between the two years.
     */
    public SearchResults titleInYears(String word, long fromYear, long toYear, int limit) throws IOException {
        ObjectNode bool = query("bool").put("limit", limit);
        ArrayNode must = bool.putArray("must");
        must.add(query("text").put("query", word));
        must.add(query("range_i64").put("field", "year").put("min", fromYear).put("max", toYear));
        bool.putArray("should");
        bool.putArray("must_not");
        return run(bool);
    }

    /**
     * Closes the index and opens it again from disk.
     *
     * @return The number of documents found after reopening
     */
    public long reopen() throws IOException {
        index.close();
        index = SearchIndex.open(indexPath);
        return index.numDocs();
    }

    private static ObjectNode query(String type) {
        return MAPPER.createObjectNode().put("type", type);
    }

    private SearchResults run(ObjectNode query) throws IOException {
        return index.search(index.getQueryParser().parse(query));
    }

    @Override
    public void close() throws IOException {
        index.close();
    }

    private static void printResults(String title, SearchResults results) {
        System.out.println("Search: " + title);
        System.out.println("   Found " + results.getCount() + " results:");
        for (SearchHit hit : results.getHits()) {
            System.out.printf("   - [%s] %s (%s) rating %s, score %.3f%n", hit.getFirst("id"), hit.getFirst("title"),
                hit.getFirst("year"), hit.getFirst("rating"), hit.getScore());
        }
        System.out.println();
    }

    /**
     * Main method to run the example.
     *
     * @param args Optional index directory
     */
    public static void main(String[] args) {
        Path indexPath = args.length > 0
            ? Paths.get(args[0])
            : Paths.get(System.getProperty("java.io.tmpdir"), "jsearch-example-movies");
        System.out.println("Index path: " + indexPath);
        System.out.println();

        try (MovieSearchExample example = new MovieSearchExample(indexPath)) {
            System.out.println("Indexed " + example.indexMovies() + " movies");
            System.out.println();

            printResults("text 'dark knight'", example.text("dark knight", 10));
            printResults("fuzzy 'godfahter' (with typo)", example.fuzzy("godfahter", 2, 10));
            printResults("phrase 'lord of the rings'", example.phrase("lord of the rings", 10));
            printResults("prefix 'star'", example.prefix("star", 10));
            printResults("exact term id = 'tt0133093'", example.termMatch("id", "tt0133093", 10));
            printResults("year 1990-1999", example.yearRange(1990, 1999, 100));
            printResults("rating >= 9.0", example.minRating(9.0, 100));
            printResults("title contains 'ring' and year 2000-2010", example.titleInYears("ring", 2000, 2010, 100));

            System.out.println("Re-opening existing index...");
            System.out.println("   Found " + example.reopen() + " documents");
        } catch (IOException e) {
            System.err.println("Example failed: " + e.getMessage());
            e.printStackTrace();
        }
    }
}
