package com.ccproxy.gateway.tool;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.ccproxy.gateway.converter.model.Tool;
import com.ccproxy.gateway.exception.SchemaValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ToolSchemaValidatorTest {

    private final ToolSchemaValidator validator = new ToolSchemaValidator();
    private final ToolConversionContext ctx = ToolConversionContext.create("test-request", "OpenAI", null);

    @Test
    void shouldAcceptTenLevelsOfNesting() {
        assertDoesNotThrow(() -> validator.validate(tool(nested(10)), ctx));
    }

    @Test
    void shouldRejectElevenLevelsOfNesting() {
        SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> validator.validate(tool(nested(11)), ctx));
        assertEquals("schema nesting too deep (max 10 levels)", e.getReason());
    }

    @Test
    void shouldCountArrayItemsAsNesting() {
        JSONObject prop = JSONObject.of("type", "string");
        for (int i = 0; i < 10; i++) {
            prop = JSONObject.of("type", "array", "items", prop);
        }
        JSONObject schema = JSONObject.of("type", "object", "properties", JSONObject.of("list", prop));

        SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> validator.validate(tool(schema), ctx));
        assertEquals("schema nesting too deep (max 10 levels)", e.getReason());
    }

    @Test
    void shouldRequireObjectAtTopLevel() {
        SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> validator.validate(tool(JSONObject.of("type", "array")), ctx));
        assertEquals("input_schema.type", e.getFieldPath());
        assertEquals("schema must have type 'object'", e.getReason());
    }

    @Test
    void shouldRejectMissingSchemaAndName() {
        assertThrows(SchemaValidationException.class, () -> validator.validate(new Tool("t", null, null), ctx));
        assertThrows(SchemaValidationException.class,
                () -> validator.validate(new Tool("", null, JSONObject.of("type", "object")), ctx));
    }

    @Test
    void shouldRejectUnknownType() {
        SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> validator.validate(tool(props("{\"a\":{\"type\":\"strng\"}}")), ctx));
        assertTrue(e.getReason().startsWith("invalid type: strng"));
        assertEquals("a.type", e.getFieldPath());
    }

    @Test
    void shouldRejectNonStringType() {
        assertThrows(SchemaValidationException.class,
                () -> validator.validate(tool(props("{\"a\":{\"type\":[\"string\",\"null\"]}}")), ctx));
    }

    @Test
    void shouldOnlyWarnOnMissingTypeAndUnknownFormat() {
        assertDoesNotThrow(() -> validator.validate(tool(props(
                "{\"a\":{\"description\":\"untyped\"},\"b\":{\"type\":\"string\",\"format\":\"color\"}}")), ctx));
    }

    @Test
    void shouldValidateArrayBounds() {
        SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> validator.validate(tool(props("{\"a\":{\"type\":\"array\",\"minItems\":-1}}")), ctx));
        assertEquals("minItems cannot be negative", e.getReason());

        e = assertThrows(SchemaValidationException.class,
                () -> validator.validate(tool(props("{\"a\":{\"type\":\"array\",\"maxItems\":\"5\"}}")), ctx));
        assertEquals("maxItems must be a number", e.getReason());
    }

    @Test
    void shouldValidateStringConstraints() {
        assertEquals("minLength cannot be negative",
                reason(props("{\"a\":{\"type\":\"string\",\"minLength\":-2}}")));
        assertEquals("enum array cannot be empty",
                reason(props("{\"a\":{\"type\":\"string\",\"enum\":[]}}")));
        assertEquals("enum[1] must be a string for string type",
                reason(props("{\"a\":{\"type\":\"string\",\"enum\":[\"x\",1]}}")));
        assertDoesNotThrow(() -> validator.validate(tool(props(
                "{\"a\":{\"type\":\"string\",\"enum\":[\"x\",\"y\"],\"format\":\"email\",\"maxLength\":10}}")), ctx));
    }

    @Test
    void shouldValidateNumberConstraints() {
        assertEquals("minimum must be a number",
                reason(props("{\"a\":{\"type\":\"number\",\"minimum\":\"0\"}}")));
        assertEquals("multipleOf must be greater than 0",
                reason(props("{\"a\":{\"type\":\"integer\",\"multipleOf\":0}}")));
        assertDoesNotThrow(() -> validator.validate(tool(props(
                "{\"a\":{\"type\":\"number\",\"minimum\":0,\"exclusiveMaximum\":1.5,\"multipleOf\":0.5}}")), ctx));
    }

    @Test
    void shouldValidateObjectConstraints() {
        assertEquals("additionalProperties must be boolean or schema object",
                reason(props("{\"a\":{\"type\":\"object\",\"additionalProperties\":\"yes\"}}")));
        assertEquals("required[0] must be a string",
                reason(props("{\"a\":{\"type\":\"object\",\"required\":[1]}}")));
        assertEquals("invalid type: bogus (allowed: [string number integer boolean array object null])",
                reason(props("{\"a\":{\"type\":\"object\",\"additionalProperties\":{\"type\":\"bogus\"}}}")));
    }

    @Test
    void shouldValidateTopLevelRequired() {
        JSONObject schema = JSONObject.of("type", "object", "required", JSONArray.of("a", 2));
        SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> validator.validate(tool(schema), ctx));
        assertEquals("input_schema.required[1]", e.getFieldPath());
    }

    @Test
    void shouldAcceptNullContext() {
        assertDoesNotThrow(() -> validator.validate(tool(props("{\"a\":{}}")), null));
    }

    private String reason(JSONObject schema) {
        return assertThrows(SchemaValidationException.class, () -> validator.validate(tool(schema), ctx)).getReason();
    }

    private static Tool tool(JSONObject schema) {
        return new Tool("test_tool", "for tests", schema);
    }

    private static JSONObject props(String properties) {
        return JSONObject.of("type", "object", "properties", JSON.parseObject(properties));
    }

    /**
     * 最深的属性位于第 levels 层
     */
    private static JSONObject nested(int levels) {
        JSONObject prop = JSONObject.of("type", "string");
        for (int i = levels; i > 1; i--) {
            prop = JSONObject.of("type", "object", "properties", JSONObject.of("level" + i, prop));
        }
        return JSONObject.of("type", "object", "properties", JSONObject.of("level1", prop));
    }
}
