package me.misix.bot.domain.system;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LlmJsonParserTest {

    private final LlmJsonParser parser = new LlmJsonParser(new ObjectMapper());

    @Test
    void shouldParsePlainObject() {
        Optional<JsonNode> node = parser.parseObject("{\"title\": \"купить молоко\"}");

        assertTrue(node.isPresent());
        assertEquals("купить молоко", node.get().get("title").asText());
    }

    @Test
    void shouldPreferMarkdownCodeBlock() {
        String response = "Вот результат:\n```json\n{\"amount\": 500, \"meta\": {\"a\": 1}}\n```\nГотово {}";

        Optional<JsonNode> node = parser.parseObject(response);

        assertTrue(node.isPresent());
        assertEquals(500, node.get().get("amount").asInt());
        assertEquals(1, node.get().get("meta").get("a").asInt());
    }

    @Test
    void shouldExtractOutermostBracesFromProse() {
        assertEquals("{\"a\": {\"b\": 1}}",
                LlmJsonParser.extractJson("Sure! {\"a\": {\"b\": 1}} hope this helps"));
    }

    @Test
    void shouldReturnEmptyForNonObjects() {
        assertTrue(parser.parseObject("[1, 2]").isEmpty());
        assertTrue(parser.parseObject("not json at all").isEmpty());
        assertTrue(parser.parseObject("").isEmpty());
        assertTrue(parser.parseObject(null).isEmpty());
    }
}
