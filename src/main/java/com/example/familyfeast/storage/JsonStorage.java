package com.example.familyfeast.storage;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.example.familyfeast.model.*;
import java.io.*;
import java.util.*;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** Reads recipe and vote snapshots handed over by the host app, and writes selections back out. */
public class JsonStorage {
    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .registerModule(new JavaTimeModule());

    public List<Recipe> loadRecipes(InputStream in) throws IOException {
        try {
            return mapper.readValue(in, new TypeReference<List<Recipe>>() {});
        } catch (IOException ex) {
            throw new IOException("Failed to parse recipes JSON. Ensure it is an array of Recipe objects.", ex);
        }
    }

    public List<Vote> loadVotes(InputStream in) throws IOException {
        byte[] data = in.readAllBytes();
        List<Vote> list = null;
        IOException last = null;
        try {
            list = mapper.readValue(new ByteArrayInputStream(data), new TypeReference<List<Vote>>(){});
        } catch (IOException ex) { last = ex; }
        if (list == null) {
            try {
                VotesWrapper wrap = mapper.readValue(new ByteArrayInputStream(data), VotesWrapper.class);
                if (wrap != null) list = wrap.votes;
            } catch (IOException ex) { last = ex; }
        }
        if (list == null) {
            throw new IOException("Failed to parse votes JSON. Provide an array of Votes or {\"votes\":[...] }.", last);
        }
        return list;
    }

    public static class VotesWrapper { public List<Vote> votes; }

    public MealSession loadSession(InputStream in) throws IOException {
        try {
            return mapper.readValue(in, MealSession.class);
        } catch (IOException ex) {
            throw new IOException("Failed to parse session JSON. Expect a MealSession object.", ex);
        }
    }

    public void writeRecipes(List<Recipe> recipes, OutputStream out) throws IOException {
        mapper.writeValue(out, recipes);
    }

    public String toJson(Object value) throws IOException {
        return mapper.writeValueAsString(value);
    }
}
