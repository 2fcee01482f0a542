package com.jsearch.examples;

import com.jsearch.query.SearchHit;
import com.jsearch.query.SearchResults;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class MovieSearchExampleTest {
    @TempDir
    Path tempDir;

    private MovieSearchExample example;

    @BeforeEach
    void setUp() throws IOException {
        example = new MovieSearchExample(tempDir.resolve("movies"));
        assertThat(example.indexMovies()).isEqualTo(MovieSearchExample.MOVIES.length);
    }

    @AfterEach
    void tearDown() throws IOException {
        example.close();
    }

    private static Object title(SearchResults results, int index) {
        return results.getHits().get(index).getFirst("title");
    }

    @Test
    void shouldFindTheDarkKnightByText() throws IOException {
        SearchResults results = example.text("dark knight", 10);

        assertThat(results.getCount()).isEqualTo(1);
        assertThat(title(results, 0)).isEqualTo("The Dark Knight");
        assertThat(results.getHits().get(0).getFirst("year")).isEqualTo(2008L);
    }

    @Test
    void shouldTolerateTypos() throws IOException {
        SearchResults results = example.fuzzy("godfahter", 2, 10);

        assertThat(results.getCount()).isEqualTo(1);
        assertThat(title(results, 0)).isEqualTo("The Godfather");
    }

    @Test
    void shouldFindBothLordOfTheRingsFilms() throws IOException {
        SearchResults results = example.phrase("lord of the rings", 10);

        assertThat(results.getHits()).extracting(hit -> hit.getFirst("id"))
            .containsExactlyInAnyOrder("tt0167260", "tt0120737");
    }

    @Test
    void shouldMatchPrefixAndExactId() throws IOException {
        assertThat(title(example.prefix("star", 10), 0))
            .isEqualTo("Star Wars: Episode V - The Empire Strikes Back");
        assertThat(example.prefix("star", 10).getCount()).isEqualTo(1);

        SearchResults byId = example.termMatch("id", "tt0133093", 10);
        assertThat(byId.getCount()).isEqualTo(1);
        assertThat(title(byId, 0)).isEqualTo("The Matrix");
        assertThat(example.termMatch("id", "TT0133093", 10).getCount()).isZero();
    }

    @Test
    void shouldFilterByNumericRanges() throws IOException {
        SearchResults nineties = example.yearRange(1990, 1999, 100);
        assertThat(nineties.getCount()).isEqualTo(5);
        assertThat(nineties.getHits()).allSatisfy(hit ->
            assertThat((Long) hit.getFirst("year")).isBetween(1990L, 1999L));

        SearchResults topRated = example.minRating(9.0, 100);
        assertThat(topRated.getCount()).isEqualTo(5);
        assertThat(topRated.getHits()).extracting(SearchHit::getScore).containsOnly(1.0);
    }

    @Test
    void shouldCombineTextAndYearRange() throws IOException {
        SearchResults results = example.titleInYears("ring", 2000, 2010, 100);

        assertThat(results.getCount()).isEqualTo(1);
        assertThat(title(results, 0)).isEqualTo("The Lord of the Rings: The Fellowship of the Ring");
    }

    @Test
    void shouldKeepAllMoviesAfterReopen() throws IOException {
        assertThat(example.reopen()).isEqualTo(10);
        assertThat(example.text("matrix", 10).getCount()).isEqualTo(1);
    }

    @Test
    void shouldReplaceAnExistingIndexDirectory() throws IOException {
        Path path = tempDir.resolve("replaced");
        try (MovieSearchExample first = new MovieSearchExample(path)) {
            first.indexMovies();
        }

        try (MovieSearchExample second = new MovieSearchExample(path)) {
            assertThat(second.text("matrix", 10).getCount()).isZero();
            assertThat(Files.isDirectory(path)).isTrue();
        }
    }
}
