package net.stepwise.adapter.jdbc.work;

import net.stepwise.core.exception.ValidationException;

import java.util.regex.Pattern;

/** SQL 에 직접 이어 붙이는 식별자 검증. 스키마 한정(schema.table)까지 허용한다. */
public final class SqlIdentifiers {
    private static final Pattern IDENT =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}(\\.[A-Za-z_][A-Za-z0-9_]{0,62})?");

    private SqlIdentifiers() {}

    public static String require(String what, String identifier) {
        if (identifier == null || !IDENT.matcher(identifier).matches()) {
            throw new ValidationException("Invalid " + what + " identifier: " + identifier);
        }
        return identifier;
    }
}
