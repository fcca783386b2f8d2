package com.logicsynth.facts;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logicsynth.ir.CompositeKind;
import com.logicsynth.ir.Lexicon;
import com.logicsynth.ir.Term;
import com.logicsynth.schema.ValueType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Shape-based typing of untagged values, used only by the loose ingestion path.
 *
 * A string becomes a name constant when it already starts with {@code /}, or when it is
 * a single bare identifier (see {@link Lexicon#isBareIdentifier}) and the declared bound
 * does not ask for {@code /string}. A {@code /name} bound always promotes. Everything else
 * keeps its JSON type.
 */
public final class LoosePromotion {

    private static final ObjectMapper JSON = new ObjectMapper();

    private LoosePromotion() {}

    /**
     * @param expected the declared type at this position, or null when unconstrained
     */
    public static Term promote(Object raw, ValueType expected) {
        if (raw == null) {
            throw new IllegalArgumentException("null is not a fact argument");
        }
        if (raw instanceof String s) {
            return promoteString(s, expected);
        }
        if (raw instanceof Boolean b) {
            return new Term.Name(b ? "/true" : "/false");
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return new Term.Number(((java.lang.Number) raw).longValue());
        }
        if (raw instanceof BigInteger big) {
            return new Term.Number(big.longValueExact());
        }
        if (raw instanceof Double || raw instanceof Float || raw instanceof BigDecimal) {
            return new Term.Float64(((java.lang.Number) raw).doubleValue());
        }
        if (raw instanceof List<?> list) {
            return new Term.Composite(CompositeKind.LIST,
                list.stream().map(item -> promote(item, null)).toList());
        }
        if (raw instanceof Map<?, ?> map) {
            try {
                return new Term.Text(JSON.writeValueAsString(map));
            } catch (JsonProcessingException ex) {
                throw new IllegalArgumentException("object argument cannot be serialised: " + ex.getOriginalMessage(), ex);
            }
        }
        return new Term.Text(raw.toString());
    }

    static Term promoteString(String value, ValueType expected) {
        if (expected == ValueType.STRING) {
            return new Term.Text(value);
        }
        if (value.startsWith(Lexicon.NAME_PREFIX)) {
            return new Term.Name(value);
        }
        if (expected == ValueType.NAME || Lexicon.isBareIdentifier(value)) {
            return new Term.Name(Lexicon.NAME_PREFIX + value);
        }
        return new Term.Text(value);
    }
}
