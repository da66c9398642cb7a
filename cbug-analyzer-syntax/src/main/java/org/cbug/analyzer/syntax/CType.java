package org.cbug.analyzer.syntax;

import java.util.Objects;

/**
 * Static type of a C expression or symbol, reduced to what the checkers need: a category, the spelled name,
 * the element type of pointers and arrays, and the length of fixed-size arrays (-1 when unknown).
 */
public record CType(TypeCategory category, String name, CType elementType, int arrayLength) {

    public static final CType UNKNOWN = new CType(TypeCategory.UNKNOWN, "?", null, -1);
    public static final CType VOID = new CType(TypeCategory.VOID, "void", null, -1);
    public static final CType CHAR = integral("char");
    public static final CType INT = integral("int");
    public static final CType LONG = integral("long");
    public static final CType UNSIGNED_LONG = integral("unsigned long");
    public static final CType FLOAT = floating("float");
    public static final CType DOUBLE = floating("double");
    public static final CType VOID_POINTER = pointerTo(VOID);
    public static final CType CHAR_POINTER = pointerTo(CHAR);

    public CType {
        Objects.requireNonNull(category);
        Objects.requireNonNull(name);
    }

    public static CType integral(String name) {
        return new CType(TypeCategory.INTEGRAL, name, null, -1);
    }

    public static CType floating(String name) {
        return new CType(TypeCategory.FLOATING, name, null, -1);
    }

    public static CType struct(String name) {
        return new CType(TypeCategory.STRUCT, name, null, -1);
    }

    public static CType function(CType returnType) {
        return new CType(TypeCategory.FUNCTION, "function", returnType, -1);
    }

    public static CType pointerTo(CType elementType) {
        return new CType(TypeCategory.POINTER, elementType.name + " *", elementType, -1);
    }

    public static CType arrayOf(CType elementType, int length) {
        return new CType(TypeCategory.ARRAY, elementType.name + "[" + (length < 0 ? "" : length) + "]",
                elementType, length);
    }

    public boolean isPointer() {
        return category == TypeCategory.POINTER;
    }

    public boolean isArray() {
        return category == TypeCategory.ARRAY;
    }

    public boolean isPointerLike() {
        return category == TypeCategory.POINTER || category == TypeCategory.ARRAY;
    }

    public boolean isIntegral() {
        return category == TypeCategory.INTEGRAL;
    }

    public boolean isFloating() {
        return category == TypeCategory.FLOATING;
    }

    public boolean isArithmetic() {
        return category == TypeCategory.INTEGRAL || category == TypeCategory.FLOATING;
    }

    public boolean isKnown() {
        return category != TypeCategory.UNKNOWN;
    }

    public boolean isUnsigned() {
        return category == TypeCategory.INTEGRAL && (name.startsWith("unsigned") || "size_t".equals(name)
                                                     || "_Bool".equals(name));
    }

    // char, signed char, unsigned char
    public boolean isCharacter() {
        return category == TypeCategory.INTEGRAL && name.endsWith("char");
    }

    /*
    for pointers and arrays; the element type of an array decays the same way as the pointee
     */
    public CType pointee() {
        return elementType == null ? UNKNOWN : elementType;
    }

    public CType decay() {
        return category == TypeCategory.ARRAY ? pointerTo(pointee()) : this;
    }

    @Override
    public String toString() {
        return name;
    }
}
