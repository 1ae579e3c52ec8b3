package org.desugar.ast.type;

import java.util.EnumMap;
import java.util.Map;

public final class BuiltinType extends Type {

    public enum Kind {
        VOID("void", "", false),
        BOOL("bool", "", false),
        CHAR("char", "", true),
        SIGNED_CHAR("signed char", "", true),
        UNSIGNED_CHAR("unsigned char", "", false),
        WCHAR("wchar_t", "", true),
        CHAR8("char8_t", "", false),
        CHAR16("char16_t", "", false),
        CHAR32("char32_t", "", false),
        SHORT("short", "", true),
        UNSIGNED_SHORT("unsigned short", "", false),
        INT("int", "", true),
        UNSIGNED_INT("unsigned int", "u", false),
        LONG("long", "l", true),
        UNSIGNED_LONG("unsigned long", "ul", false),
        LONG_LONG("long long", "ll", true),
        UNSIGNED_LONG_LONG("unsigned long long", "ull", false),
        FLOAT("float", "f", true),
        DOUBLE("double", "", true),
        LONG_DOUBLE("long double", "L", true),
        NULLPTR("std::nullptr_t", "", false);

        private final String spelling;
        private final String literalSuffix;
        private final boolean signed;

        Kind(String spelling, String literalSuffix, boolean signed) {
            this.spelling = spelling;
            this.literalSuffix = literalSuffix;
            this.signed = signed;
        }

        public String getSpelling() {
            return spelling;
        }

        public String getLiteralSuffix() {
            return literalSuffix;
        }

        public boolean isSigned() {
            return signed;
        }

        public boolean isFloating() {
            return this == FLOAT || this == DOUBLE || this == LONG_DOUBLE;
        }
    }

    private static final Map<Kind, BuiltinType> INSTANCES = new EnumMap<>(Kind.class);

    static {
        for (Kind kind : Kind.values()) {
            INSTANCES.put(kind, new BuiltinType(kind));
        }
    }

    public static final BuiltinType VOID = of(Kind.VOID);
    public static final BuiltinType BOOL = of(Kind.BOOL);
    public static final BuiltinType CHAR = of(Kind.CHAR);
    public static final BuiltinType INT = of(Kind.INT);
    public static final BuiltinType UNSIGNED_INT = of(Kind.UNSIGNED_INT);
    public static final BuiltinType LONG = of(Kind.LONG);
    public static final BuiltinType UNSIGNED_LONG = of(Kind.UNSIGNED_LONG);
    public static final BuiltinType FLOAT = of(Kind.FLOAT);
    public static final BuiltinType DOUBLE = of(Kind.DOUBLE);

    private final Kind kind;

    private BuiltinType(Kind kind) {
        this.kind = kind;
    }

    public static BuiltinType of(Kind kind) {
        return INSTANCES.get(kind);
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public boolean isBuiltinType() {
        return true;
    }

    @Override
    public boolean isSignedIntegerType() {
        return kind.isSigned() && !kind.isFloating();
    }

    @Override
    public <R, A> R accept(TypeVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }

    @Override
    public String toString() {
        return kind.getSpelling();
    }
}
