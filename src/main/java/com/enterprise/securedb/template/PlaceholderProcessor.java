package com.enterprise.securedb.template;

import com.enterprise.securedb.core.IdentifierQuoter;
import com.enterprise.securedb.exception.ArrayParamException;
import com.enterprise.securedb.exception.IdentifierTypeException;
import com.enterprise.securedb.exception.MissingParameterException;
import com.enterprise.securedb.exception.TemplateException;
import com.enterprise.securedb.param.Param;
import com.enterprise.securedb.param.Params;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Rewrites placeholders into driver SQL.
 *
 * <p>Two phases over the whole template:
 * <ol>
 *   <li>{@code ?_name} becomes the quoted identifier {@code prefix + name}; no parameter
 *       is used.</li>
 *   <li>{@code ?#}, {@code ?a} and {@code ?} are resolved left to right, each popping the
 *       next parameter:
 *     <ul>
 *       <li>{@code ?#} → quoted identifier; the value must be a string.</li>
 *       <li>{@code ?a} with a list, or a map keyed {@code 0..n-1} → {@code ?, ?, ?}.</li>
 *       <li>{@code ?a} with any other map → {@code `k1` = ?, `k2` = ?}.</li>
 *       <li>{@code ?} → {@code ?} with the value bound.</li>
 *     </ul>
 *   </li>
 * </ol>
 * Every bound value and identifier goes through {@link Params#unwrap} first.
 */
public final class PlaceholderProcessor {

    private final IdentifierQuoter quoter;
    private final String identifierPrefix;

    public PlaceholderProcessor(TemplateSettings settings) {
        Objects.requireNonNull(settings, "settings");
        this.quoter = new IdentifierQuoter(settings.dialect());
        this.identifierPrefix = settings.identifierPrefix();
    }

    public BoundQuery substitute(String query, List<Param> params) {
        return substitute(TemplateLexer.tokenize(query), params);
    }

    public BoundQuery substitute(List<TemplateToken> tokens, List<Param> params) {
        List<TemplateToken> resolved = resolvePrefixes(tokens);

        StringBuilder sql = new StringBuilder();
        List<Object> bound = new ArrayList<>(params.size());
        int index = 0;

        for (TemplateToken token : resolved) {
            if (token instanceof TemplateToken.IdentifierPlaceholder) {
                Param param = next(params, index++, token);
                sql.append(quoter.quoteIdentifier(identifierValue(param)));
            } else if (token instanceof TemplateToken.ArrayPlaceholder) {
                Param param = next(params, index++, token);
                sql.append(expandArray(param, bound));
            } else if (token instanceof TemplateToken.Positional) {
                Param param = next(params, index++, token);
                bound.add(scalarValue(param));
                sql.append('?');
            } else {
                sql.append(token.text());
            }
        }
        return new BoundQuery(sql.toString(), bound);
    }

    private List<TemplateToken> resolvePrefixes(List<TemplateToken> tokens) {
        List<TemplateToken> resolved = new ArrayList<>(tokens.size());
        for (TemplateToken token : tokens) {
            if (token instanceof TemplateToken.PrefixedPlaceholder prefixed) {
                resolved.add(new TemplateToken.Literal(
                        quoter.quoteIdentifier(identifierPrefix + prefixed.name())));
            } else {
                resolved.add(token);
            }
        }
        return resolved;
    }

    private static Param next(List<Param> params, int index, TemplateToken token) {
        if (index >= params.size()) {
            throw new MissingParameterException(token.text(), index);
        }
        return params.get(index);
    }

    private static String identifierValue(Param param) {
        Object value;
        if (param instanceof Param.Scalar scalar) {
            value = Params.unwrap(scalar.value());
        } else if (param instanceof Param.Extractable extractable) {
            value = extractable.wrapped().toNative();
        } else {
            throw new IdentifierTypeException(param);
        }
        if (!(value instanceof String s)) {
            throw new IdentifierTypeException(value);
        }
        return s;
    }

    private String expandArray(Param param, List<Object> bound) {
        Param collection = param instanceof Param.Extractable extractable
                ? Params.of(extractable.wrapped().toNative())
                : param;

        if (collection instanceof Param.Sequence sequence) {
            if (sequence.size() == 0) {
                throw new ArrayParamException("Array placeholder ?a cannot be empty");
            }
            return inList(sequence.elements(), bound);
        }
        if (collection instanceof Param.Mapping mapping) {
            if (mapping.size() == 0) {
                throw new ArrayParamException("Array placeholder ?a cannot be empty");
            }
            if (!mapping.isAssociative()) {
                return inList(new ArrayList<>(mapping.entries().values()), bound);
            }
            StringJoiner assignments = new StringJoiner(", ");
            for (Map.Entry<Object, Param> entry : mapping.entries().entrySet()) {
                assignments.add(quoter.quoteIdentifier(String.valueOf(entry.getKey())) + " = ?");
                bound.add(elementValue(entry.getValue()));
            }
            return assignments.toString();
        }
        throw new ArrayParamException(
                "Array placeholder ?a requires a list, array or map parameter, got " + describe(collection));
    }

    private static String inList(List<Param> elements, List<Object> bound) {
        StringJoiner markers = new StringJoiner(", ");
        for (Param element : elements) {
            markers.add("?");
            bound.add(elementValue(element));
        }
        return markers.toString();
    }

    private static Object elementValue(Param element) {
        if (element instanceof Param.Sequence || element instanceof Param.Mapping) {
            throw new ArrayParamException("Array placeholder ?a does not support nested collections");
        }
        if (element.isSkip()) {
            throw new ArrayParamException("Array placeholder ?a cannot contain the skip marker");
        }
        return scalarValue(element);
    }

    private static Object scalarValue(Param param) {
        if (param instanceof Param.Scalar scalar) {
            return Params.unwrap(scalar.value());
        }
        if (param instanceof Param.Extractable extractable) {
            return extractable.wrapped().toNative();
        }
        if (param.isSkip()) {
            throw new TemplateException("Skip marker is only allowed among macro block parameters");
        }
        throw new ArrayParamException(
                "Placeholder ? cannot bind " + describe(param) + "; use ?a for lists and maps");
    }

    private static String describe(Param param) {
        if (param instanceof Param.Scalar scalar) {
            return scalar.value() == null ? "null" : scalar.value().getClass().getName();
        }
        return param.getClass().getSimpleName().toLowerCase();
    }
}
