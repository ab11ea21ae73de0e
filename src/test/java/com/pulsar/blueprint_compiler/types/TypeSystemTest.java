package com.pulsar.blueprint_compiler.types;

import com.pulsar.blueprint_compiler.model.types.TypeInfo;
import com.pulsar.blueprint_compiler.model.types.WrapperType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TypeSystemTest {

    @Test
    void shouldPeelWrappersOutsideIn() {
        TypeInfo type = TypeSystem.parse("Arc<Vec<String>>");

        assertEquals("String", type.baseType());
        assertEquals(List.of(WrapperType.SHARED_REF, WrapperType.LIST), type.wrappers());
        assertFalse(type.wildcard());
    }

    @Test
    void shouldFormatBackToTheSameSpelling() {
        for (String spelling : List.of("i32", "&str", "&mut T", "Option<Box<f64>>", "Result<Vec<u8>>", "HashSet<bool>")) {
            assertEquals(spelling, TypeSystem.format(TypeSystem.parse(spelling)));
        }
    }

    @Test
    void shouldPreferMutableBorrowOverBorrow() {
        TypeInfo type = TypeSystem.parse("&mut Vec<i64>");

        assertEquals(List.of(WrapperType.MUTABLE_BORROW, WrapperType.LIST), type.wrappers());
        assertEquals("i64", type.baseType());
    }

    @Test
    void shouldTreatSingleUppercaseLettersAsWildcards() {
        assertTrue(TypeSystem.parse("T").wildcard());
        assertTrue(TypeSystem.parse("Vec<T>").wildcard());
        assertTrue(TypeSystem.parse("?").wildcard());
        assertFalse(TypeSystem.parse("String").wildcard());
        assertEquals("T", TypeSystem.parse("Option<T>").baseType());
    }

    @Test
    void shouldRejectBlankTypeString() {
        assertThrows(IllegalArgumentException.class, () -> TypeSystem.parse("  "));
    }

    @Test
    void shouldRequireIdenticalStructureForCompatibility() {
        assertTrue(TypeSystem.isCompatible(TypeSystem.parse("Vec<i32>"), TypeSystem.parse("Vec<i32>")));
        assertFalse(TypeSystem.isCompatible(TypeSystem.parse("Vec<i32>"), TypeSystem.parse("i32")));
        assertTrue(TypeSystem.isCompatible(TypeSystem.parse("T"), TypeSystem.parse("Vec<i32>")));
    }

    @Test
    void shouldWidenButNeverNarrow() {
        assertTrue(TypeSystem.canConvert(TypeSystem.parse("i32"), TypeSystem.parse("f64")));
        assertTrue(TypeSystem.canConvert(TypeSystem.parse("u8"), TypeSystem.parse("i128")));
        assertTrue(TypeSystem.canConvert(TypeSystem.parse("f32"), TypeSystem.parse("f64")));
        assertFalse(TypeSystem.canConvert(TypeSystem.parse("f64"), TypeSystem.parse("i32")));
        assertFalse(TypeSystem.canConvert(TypeSystem.parse("i64"), TypeSystem.parse("i32")));
        assertFalse(TypeSystem.canConvert(TypeSystem.parse("bool"), TypeSystem.parse("i32")));
    }

    @Test
    void shouldConvertBetweenStringSlicesAndOwnedStrings() {
        assertTrue(TypeSystem.canConvert(TypeSystem.parse("&str"), TypeSystem.parse("String")));
        assertTrue(TypeSystem.canConvert(TypeSystem.parse("String"), TypeSystem.parse("&str")));
    }

    @Test
    void shouldAllowWrapperChangesAroundTheSameBase() {
        assertTrue(TypeSystem.canConvert(TypeSystem.parse("Vec<i32>"), TypeSystem.parse("i32")));
        assertTrue(TypeSystem.canConvert(TypeSystem.parse("i32"), TypeSystem.parse("Option<i32>")));
    }

    @Test
    void shouldCloseWideningTableTransitively() {
        assertTrue(TypeSystem.wideningsOf("u8").containsAll(List.of("u16", "u32", "u64", "i16", "i32", "f32", "f64")));
        assertFalse(TypeSystem.wideningsOf("u8").contains("u8"));
        assertTrue(TypeSystem.wideningsOf("f64").isEmpty());
    }

    @Test
    void shouldPickDefaultLiteralsByType() {
        assertEquals("0.0", TypeSystem.defaultValue(TypeSystem.parse("f64")));
        assertEquals("(0.0, 0.0, 0.0)", TypeSystem.defaultValue(TypeSystem.parse("(f32, f32, f32)")));
        assertEquals("Default::default()", TypeSystem.defaultValue(TypeSystem.parse("i32")));
        assertEquals("Default::default()", TypeSystem.defaultValue(TypeSystem.parse("String")));
    }

    @Test
    void shouldDescribeCommonTypes() {
        assertEquals("Integer (64-bit)", TypeSystem.displayName("i64"));
        assertEquals("Unit", TypeSystem.displayName("()"));
        assertEquals("Tuple: (f32, f32)", TypeSystem.displayName("(f32, f32)"));
        assertEquals("Vec<u8>", TypeSystem.displayName("Vec<u8>"));
    }
}
