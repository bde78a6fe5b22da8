package org.celtext;

import org.celtext.ast.Constant;
import org.celtext.ast.Expr;
import org.celtext.ast.SourceInfo;
import org.celtext.literal.Unescaper;
import org.celtext.result.Result;
import org.celtext.unparse.Unparser;
import org.celtext.unparse.UnparserConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for literal decoding and expression unparsing.
 *
 * <p>Example usage:
 * <pre>{@code
 * var text = CelText.unescapeString("'''it's'''").unwrap();
 *
 * var f = ExprFactory.exprFactory();
 * var expr = f.call(Operators.SUBTRACT, f.ident("a"), f.call(Operators.SUBTRACT, f.ident("b"), f.ident("c")));
 * var source = CelText.unparse(expr, SourceInfo.EMPTY).unwrap(); // a - (b - c)
 * }</pre>
 */
public final class CelText {
    private static final Logger LOGGER = LoggerFactory.getLogger(CelText.class);

    private CelText() {}

    /**
     * Decode a quoted string ({@code isBytes == false}) or bytes literal token.
     */
    public static Result<Constant> unescape(String token, boolean isBytes) {
        return Unescaper.unescape(token, isBytes)
                        .onFailure(cause -> LOGGER.debug("Unable to decode literal: {}", cause.message()));
    }

    public static Result<String> unescapeString(String token) {
        return Unescaper.unescapeString(token)
                        .onFailure(cause -> LOGGER.debug("Unable to decode string literal: {}", cause.message()));
    }

    public static Result<byte[]> unescapeBytes(String token) {
        return Unescaper.unescapeBytes(token)
                        .onFailure(cause -> LOGGER.debug("Unable to decode bytes literal: {}", cause.message()));
    }

    /**
     * Render an expression tree as source text, restoring spacing and line breaks from the source info.
     */
    public static Result<String> unparse(Expr expr, SourceInfo info) {
        return unparse(expr, info, UnparserConfig.DEFAULT);
    }

    /**
     * Render an expression tree as source text with custom configuration.
     */
    public static Result<String> unparse(Expr expr, SourceInfo info, UnparserConfig config) {
        return Unparser.unparse(expr, info, config)
                       .onFailure(cause -> LOGGER.debug("Unable to unparse expression #{}: {}", expr.id(), cause.message()));
    }

    /**
     * Render an expression tree as compact canonical text, ignoring source positions.
     */
    public static Result<String> unparse(Expr expr) {
        return unparse(expr, SourceInfo.EMPTY, UnparserConfig.COMPACT);
    }
}
