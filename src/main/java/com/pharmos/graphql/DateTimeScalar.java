package com.pharmos.graphql;

import graphql.GraphQLContext;
import graphql.execution.CoercedVariables;
import graphql.language.StringValue;
import graphql.language.Value;
import graphql.schema.Coercing;
import graphql.schema.CoercingParseLiteralException;
import graphql.schema.CoercingParseValueException;
import graphql.schema.CoercingSerializeException;
import graphql.schema.GraphQLScalarType;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * {@code DateTime} scalar backed by {@link Instant}.
 *
 * Serializes to ISO-8601 in UTC. Accepts an ISO-8601 offset date-time, or a
 * plain date read as midnight UTC, and rejects anything else with a coercion error.
 */
public final class DateTimeScalar {

    public static final GraphQLScalarType INSTANCE = GraphQLScalarType.newScalar()
        .name("DateTime")
        .description("ISO-8601 date-time, serialized in UTC; a plain date is read as midnight UTC")
        .coercing(new InstantCoercing())
        .build();

    private static final int DATE_ONLY_LENGTH = "yyyy-MM-dd".length();

    private DateTimeScalar() {
    }

    /**
     * @throws DateTimeParseException if the value is neither an ISO-8601 date-time with offset nor a date
     */
    static Instant parse(String value) {
        if (value.length() == DATE_ONLY_LENGTH) {
            return LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    }

    private static final class InstantCoercing implements Coercing<Instant, String> {

        @Override
        public String serialize(Object dataFetcherResult, GraphQLContext context, Locale locale) {
            if (dataFetcherResult instanceof Instant) {
                return DateTimeFormatter.ISO_INSTANT.format((Instant) dataFetcherResult);
            }
            if (dataFetcherResult instanceof OffsetDateTime) {
                return DateTimeFormatter.ISO_INSTANT.format(((OffsetDateTime) dataFetcherResult).toInstant());
            }
            if (dataFetcherResult instanceof ZonedDateTime) {
                return DateTimeFormatter.ISO_INSTANT.format(((ZonedDateTime) dataFetcherResult).toInstant());
            }
            if (dataFetcherResult instanceof String) {
                try {
                    return DateTimeFormatter.ISO_INSTANT.format(parse((String) dataFetcherResult));
                } catch (DateTimeParseException e) {
                    throw new CoercingSerializeException("Value is not a valid DateTime: " + dataFetcherResult, e);
                }
            }
            throw new CoercingSerializeException("Value is not a valid DateTime: " + dataFetcherResult);
        }

        @Override
        public Instant parseValue(Object input, GraphQLContext context, Locale locale) {
            if (input instanceof Instant) {
                return (Instant) input;
            }
            if (!(input instanceof String)) {
                throw new CoercingParseValueException("Expected an ISO-8601 string but got: " + input);
            }
            try {
                return parse((String) input);
            } catch (DateTimeParseException e) {
                throw new CoercingParseValueException("Value is not a valid DateTime: " + input, e);
            }
        }

        @Override
        public Instant parseLiteral(Value<?> input, CoercedVariables variables, GraphQLContext context, Locale locale) {
            if (!(input instanceof StringValue)) {
                throw new CoercingParseLiteralException(
                    "Can only parse strings to DateTime but got: " + input.getClass().getSimpleName());
            }
            String value = ((StringValue) input).getValue();
            try {
                return parse(value);
            } catch (DateTimeParseException e) {
                throw new CoercingParseLiteralException("Value is not a valid DateTime: " + value, e);
            }
        }

        @Override
        public Value<?> valueToLiteral(Object input, GraphQLContext context, Locale locale) {
            return StringValue.newStringValue(serialize(input, context, locale)).build();
        }
    }
}
