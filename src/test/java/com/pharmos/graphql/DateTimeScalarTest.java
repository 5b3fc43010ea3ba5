package com.pharmos.graphql;

import graphql.GraphQLContext;
import graphql.execution.CoercedVariables;
import graphql.language.IntValue;
import graphql.language.StringValue;
import graphql.schema.Coercing;
import graphql.schema.CoercingParseLiteralException;
import graphql.schema.CoercingParseValueException;
import graphql.schema.CoercingSerializeException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DateTimeScalarTest {

    @SuppressWarnings("unchecked")
    private final Coercing<Instant, String> coercing =
        (Coercing<Instant, String>) DateTimeScalar.INSTANCE.getCoercing();
    private final GraphQLContext context = GraphQLContext.newContext().build();

    @Test
    void testSerialize_NormalizesToUtc() {
        Instant instant = Instant.parse("2024-03-15T10:30:00Z");
        OffsetDateTime offset = OffsetDateTime.of(2024, 3, 15, 12, 30, 0, 0, ZoneOffset.ofHours(2));

        assertThat(coercing.serialize(instant, context, Locale.ROOT)).isEqualTo("2024-03-15T10:30:00Z");
        assertThat(coercing.serialize(offset, context, Locale.ROOT)).isEqualTo("2024-03-15T10:30:00Z");
        assertThat(coercing.serialize("2024-03-15T05:30:00-05:00", context, Locale.ROOT))
            .isEqualTo("2024-03-15T10:30:00Z");
    }

    @Test
    void testSerialize_RejectsOtherTypes() {
        assertThatThrownBy(() -> coercing.serialize(42, context, Locale.ROOT))
            .isInstanceOf(CoercingSerializeException.class);
        assertThatThrownBy(() -> coercing.serialize("yesterday", context, Locale.ROOT))
            .isInstanceOf(CoercingSerializeException.class);
    }

    @Test
    void testParseValue() {
        assertThat(coercing.parseValue("2024-03-15T10:30:00Z", context, Locale.ROOT))
            .isEqualTo(Instant.parse("2024-03-15T10:30:00Z"));
        assertThat(coercing.parseValue("2024-03-15", context, Locale.ROOT))
            .isEqualTo(Instant.parse("2024-03-15T00:00:00Z"));
        assertThatThrownBy(() -> coercing.parseValue("2024-03-15T10:30:00", context, Locale.ROOT))
            .isInstanceOf(CoercingParseValueException.class);
        assertThatThrownBy(() -> coercing.parseValue("15/03/2024", context, Locale.ROOT))
            .isInstanceOf(CoercingParseValueException.class);
        assertThatThrownBy(() -> coercing.parseValue(1710498600L, context, Locale.ROOT))
            .isInstanceOf(CoercingParseValueException.class);
    }

    @Test
    void testParseLiteral() {
        Instant parsed = coercing.parseLiteral(new StringValue("2024-03-15T10:30:00+00:00"),
            CoercedVariables.emptyVariables(), context, Locale.ROOT);

        assertThat(parsed).isEqualTo(Instant.parse("2024-03-15T10:30:00Z"));
        assertThatThrownBy(() -> coercing.parseLiteral(new IntValue(BigInteger.TEN),
                CoercedVariables.emptyVariables(), context, Locale.ROOT))
            .isInstanceOf(CoercingParseLiteralException.class);
    }
}
