package com.example.familyfeast;

import static org.junit.jupiter.api.Assertions.*;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.example.familyfeast.model.*;
import com.example.familyfeast.storage.*;

public class StorageTests {

    private static InputStream json(String s) { return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8)); }

    @Test
    void loadsSampleRecipesAndDerivesCosts() throws Exception {
        JsonStorage s = new JsonStorage();
        try (InputStream in = getClass().getResourceAsStream("/sample-data/recipes.json")) {
            List<Recipe> rs = s.loadRecipes(in);
            assertEquals(6, rs.size());
            Recipe tacos = rs.get(2);
            assertEquals("Beef Tacos", tacos.title);
            assertNull(tacos.totalEstimatedCost);
            assertEquals(1500, tacos.estimatedTotalCost());
            assertEquals("mexican", tacos.cuisineOrUnknown());
            assertEquals(Difficulty.HARD, rs.get(4).difficulty);
        }
    }

    @Test
    void loadsVotesFromWrapperOrArray() throws Exception {
        JsonStorage s = new JsonStorage();
        try (InputStream in = getClass().getResourceAsStream("/sample-data/votes.json")) {
            List<Vote> votes = s.loadVotes(in);
            assertEquals(18, votes.size());
            assertEquals(VoteType.VETO, votes.get(5).type);
            assertEquals("shellfish allergy", votes.get(5).comment);
            assertEquals(VoteType.SUPER_LIKE, votes.get(7).type);   // "superLike" spelling
        }
        List<Vote> plain = s.loadVotes(json("[{\"voterId\":\"a\",\"recipeId\":\"r\",\"type\":\"dislike\"}]"));
        assertEquals(1, plain.size());
        assertEquals(VoteType.DISLIKE, plain.get(0).type);
        assertNotNull(plain.get(0).timestamp);
    }

    @Test
    void badJsonIsReportedAsIOException() {
        JsonStorage s = new JsonStorage();
        IOException ex = assertThrows(IOException.class, () -> s.loadVotes(json("{\"votes\": 3}")));
        assertTrue(ex.getMessage().contains("votes"));
        assertThrows(IOException.class, () -> s.loadVotes(json("[{\"voterId\":\"a\",\"recipeId\":\"r\",\"type\":\"meh\"}]")));
        assertThrows(IOException.class, () -> s.loadRecipes(json("{not json")));
    }

    @Test
    void voteTypesSerializeByName() throws Exception {
        JsonStorage s = new JsonStorage();
        String out = s.toJson(new Vote("a", "r", VoteType.SUPER_LIKE, "yum", null));
        assertTrue(out.contains("\"super_like\""), out);
        String veto = s.toJson(new Vote("a", "r", VoteType.VETO));
        assertTrue(veto.contains("\"veto\""), veto);
        assertFalse(veto.contains(String.valueOf(Integer.MIN_VALUE)));

        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        s.writeRecipes(List.of(new Recipe("r1", "Soup", null, Difficulty.EASY, 700)), bos);
        assertTrue(bos.toString(StandardCharsets.UTF_8).contains("\"easy\""));
    }

    @Test
    void settingsRoundTripThroughUserDirectory(@TempDir Path dir) throws Exception {
        SettingsStorage storage = new SettingsStorage(dir);
        assertEquals(60.0, storage.load().minimumConsensus);

        VotingSettings s = new VotingSettings();
        s.varietyWeighted = true;
        s.minimumConsensus = 75.0;
        storage.save(s);

        VotingSettings back = storage.load();
        assertTrue(back.varietyWeighted);
        assertEquals(75.0, back.minimumConsensus);
        assertEquals(20, back.scoreCap);
    }

    @Test
    void invalidSettingsAreRejectedOrIgnored(@TempDir Path dir) throws Exception {
        SettingsStorage storage = new SettingsStorage(dir);
        assertThrows(IllegalArgumentException.class, () -> storage.load(json("{\"scoreCap\": -1}")));
        assertThrows(IOException.class, () -> storage.load(json("{\"scoreCapp\": 10}")));

        Files.writeString(dir.resolve("voting-settings.json"), "{\"minimumConsensus\": 140}");
        assertEquals(60.0, storage.load().minimumConsensus);
    }
}
