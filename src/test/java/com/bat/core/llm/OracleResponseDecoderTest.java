package com.bat.core.llm;

import com.bat.core.model.DelegationDecision;
import com.bat.core.model.ToolSelection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OracleResponseDecoderTest {

    private final OracleResponseDecoder decoder = new OracleResponseDecoder();

    @Nested
    @DisplayName("Tool selection")
    class ToolSelectionTests {

        @Test
        @DisplayName("decodes tool name and input")
        void decodesToolAndInput() {
            ToolSelection selection = decoder.decodeToolSelection(
                    "{\"tool\": \"web_search\", \"input\": {\"query\": \"bats\", \"limit\": 5}}");

            assertEquals("web_search", selection.tool());
            assertEquals("bats", selection.input().get("query"));
            assertEquals(5, selection.input().get("limit"));
        }

        @Test
        @DisplayName("strips a ```json code fence before parsing")
        void stripsJsonCodeFence() {
            ToolSelection selection = decoder.decodeToolSelection("""
                    ```json
                    {"tool": "calculator", "input": {"expression": "2+2"}}
                    ```
                    """);

            assertEquals("calculator", selection.tool());
            assertEquals(Map.of("expression", "2+2"), selection.input());
        }

        @Test
        @DisplayName("missing input decodes to an empty map")
        void missingInputIsEmpty() {
            assertEquals(Map.of(), decoder.decodeToolSelection("{\"tool\": \"clock\"}").input());
        }

        @Test
        @DisplayName("malformed JSON is unparseable and keeps the raw reply")
        void malformedJson() {
            var ex = assertThrows(OracleResponseUnparseableException.class,
                    () -> decoder.decodeToolSelection("I think you should use web_search"));
            assertEquals("I think you should use web_search", ex.getRawResponse());
        }

        @Test
        @DisplayName("missing tool name is unparseable")
        void missingTool() {
            assertThrows(OracleResponseUnparseableException.class,
                    () -> decoder.decodeToolSelection("{\"input\": {}}"));
        }

        @Test
        @DisplayName("non-object input is unparseable")
        void nonObjectInput() {
            assertThrows(OracleResponseUnparseableException.class,
                    () -> decoder.decodeToolSelection("{\"tool\": \"x\", \"input\": \"query\"}"));
        }

        @Test
        @DisplayName("a JSON array is unparseable")
        void arrayReply() {
            assertThrows(OracleResponseUnparseableException.class,
                    () -> decoder.decodeToolSelection("[\"web_search\"]"));
        }
    }

    @Nested
    @DisplayName("Delegation")
    class DelegationTests {

        @Test
        @DisplayName("decodes a positive recommendation")
        void positive() {
            DelegationDecision decision = decoder.decodeDelegation(
                    "{\"shouldDelegate\": true, \"reason\": \"needs prose\", \"targetAgentRole\": \"Writer\"}");

            assertTrue(decision.shouldDelegate());
            assertEquals("needs prose", decision.reason());
            assertEquals("Writer", decision.toDelegation().targetAgentRole());
        }

        @Test
        @DisplayName("a negative decision needs no target")
        void negativeWithoutTarget() {
            DelegationDecision decision = decoder.decodeDelegation("{\"shouldDelegate\": false, \"reason\": \"fine\"}");
            assertFalse(decision.shouldDelegate());
            assertNull(decision.targetAgentRole());
        }

        @Test
        @DisplayName("shouldDelegate as a string is unparseable")
        void stringFlag() {
            assertThrows(OracleResponseUnparseableException.class,
                    () -> decoder.decodeDelegation("{\"shouldDelegate\": \"true\", \"targetAgentRole\": \"Writer\"}"));
        }

        @Test
        @DisplayName("positive decision without target is unparseable")
        void positiveWithoutTarget() {
            assertThrows(OracleResponseUnparseableException.class,
                    () -> decoder.decodeDelegation("{\"shouldDelegate\": true, \"reason\": \"x\"}"));
        }

        @Test
        @DisplayName("blank reply is unparseable")
        void blank() {
            assertThrows(OracleResponseUnparseableException.class, () -> decoder.decodeDelegation("   "));
        }
    }

    @Nested
    @DisplayName("Capability")
    class CapabilityTests {

        @Test
        @DisplayName("yes and no are trimmed and case-insensitive")
        void yesNo() {
            assertTrue(decoder.decodeCapability("  YES \n"));
            assertTrue(decoder.decodeCapability("yes"));
            assertFalse(decoder.decodeCapability("No"));
        }

        @Test
        @DisplayName("anything else is unparseable rather than a negative answer")
        void otherLiteral() {
            var ex = assertThrows(OracleResponseUnparseableException.class,
                    () -> decoder.decodeCapability("Yes, I can."));
            assertEquals("Yes, I can.", ex.getRawResponse());
        }
    }

    @Test
    @DisplayName("stripCodeFences leaves unfenced text alone")
    void stripCodeFencesNoFence() {
        assertEquals("{\"a\":1}", OracleResponseDecoder.stripCodeFences("  {\"a\":1}  "));
        assertEquals("{\"a\":1}", OracleResponseDecoder.stripCodeFences("```\n{\"a\":1}\n```"));
    }
}
