package io.github.eutro.wasmopt.test;

import io.github.eutro.wasmopt.entity.FunctionType;
import io.github.eutro.wasmopt.types.*;
import org.junit.jupiter.api.Test;

import static io.github.eutro.wasmopt.types.WasmType.*;
import static org.junit.jupiter.api.Assertions.*;

public class TypesTest {
    @Test
    void sizes() {
        assertEquals(4, I32.getSize());
        assertEquals(8, I64.getSize());
        assertEquals(4, F32.getSize());
        assertEquals(8, F64.getSize());
        assertThrows(IllegalArgumentException.class, NONE::getSize);
        assertTrue(F32.isFloat());
        assertFalse(I64.isFloat());
        assertFalse(NONE.isFloat());
        assertEquals("f64", F64.toString());
        assertEquals("none", NONE.toString());
    }

    @Test
    void memoryAccessTypes() {
        assertEquals(I32, WasmType.fromSizeAndKind(1, false));
        assertEquals(I32, WasmType.fromSizeAndKind(2, true));
        assertEquals(I32, WasmType.fromSizeAndKind(4, false));
        assertEquals(F32, WasmType.fromSizeAndKind(4, true));
        assertEquals(I64, WasmType.fromSizeAndKind(8, false));
        assertEquals(F64, WasmType.fromSizeAndKind(8, true));
        assertThrows(IllegalArgumentException.class, () -> WasmType.fromSizeAndKind(6, false));
        assertThrows(IllegalArgumentException.class, () -> WasmType.fromSizeAndKind(16, true));
    }

    @Test
    void operatorClasses() {
        assertTrue(BinaryOp.ADD.appliesTo(I64));
        assertTrue(BinaryOp.ADD.appliesTo(F32));
        assertFalse(BinaryOp.ADD.appliesTo(NONE));
        assertTrue(BinaryOp.SHR_U.appliesTo(I32));
        assertFalse(BinaryOp.SHR_U.appliesTo(F64));
        assertFalse(BinaryOp.COPY_SIGN.appliesTo(I32));
        assertTrue(UnaryOp.CLZ.appliesTo(I64));
        assertFalse(UnaryOp.SQRT.appliesTo(I64));
        assertTrue(RelationalOp.EQ.appliesTo(F64));
        assertFalse(RelationalOp.LT.appliesTo(I32));
        assertTrue(RelationalOp.LT_U.appliesTo(I32));
        assertEquals(OpClass.FLOAT, UnaryOp.NEAREST.getOpClass());
    }

    @Test
    void conversions() {
        assertEquals(I32, ConvertOp.EXTEND_S_INT32.getOperandType(I64));
        assertFalse(ConvertOp.EXTEND_S_INT32.appliesTo(I32));
        assertEquals(I64, ConvertOp.WRAP_INT64.getOperandType(I32));
        assertEquals(F64, ConvertOp.TRUNC_U_FLOAT64.getOperandType(I64));
        assertEquals(F32, ConvertOp.TRUNC_S_FLOAT32.getOperandType(I32));
        assertEquals(F32, ConvertOp.REINTERPRET_FLOAT.getOperandType(I32));
        assertEquals(F64, ConvertOp.REINTERPRET_FLOAT.getOperandType(I64));
        assertEquals(I64, ConvertOp.REINTERPRET_INT.getOperandType(F64));
        assertEquals(I64, ConvertOp.CONVERT_S_INT64.getOperandType(F32));
        assertEquals(F32, ConvertOp.PROMOTE_FLOAT32.getOperandType(F64));
        assertFalse(ConvertOp.PROMOTE_FLOAT32.appliesTo(F32));
        assertEquals(F64, ConvertOp.DEMOTE_FLOAT64.getOperandType(F32));
        assertThrows(IllegalArgumentException.class, () -> ConvertOp.CONVERT_U_INT32.getOperandType(I32));
    }

    @Test
    void hostArity() {
        assertEquals(0, HostOp.PAGE_SIZE.getArity());
        assertEquals(0, HostOp.MEMORY_SIZE.getArity());
        assertEquals(1, HostOp.GROW_MEMORY.getArity());
        assertEquals(0, HostOp.HAS_FEATURE.getArity());
    }

    @Test
    void literals() {
        Literal five = Literal.i32(5);
        assertEquals(I32, five.getType());
        assertEquals(5, five.getI32());
        assertEquals(5, five.getValue());
        assertEquals("i32:5", five.toString());
        assertThrows(IllegalStateException.class, five::getI64);
        assertThrows(IllegalStateException.class, five::getF32);

        assertEquals(-7L, Literal.i64(-7).getI64());
        assertEquals(1.5f, Literal.f32(1.5f).getF32());
        assertEquals(0.25, Literal.f64(0.25).getF64());

        assertEquals(Literal.f64(Double.NaN), Literal.f64(Double.NaN));
        assertNotEquals(Literal.f64(0.0), Literal.f64(-0.0));
        assertNotEquals(Literal.i32(1), Literal.i64(1));
        assertEquals(Literal.f32(0), Literal.zero(F32));
        assertThrows(IllegalArgumentException.class, () -> Literal.zero(NONE));
    }

    @Test
    void names() {
        Name x = Name.of("x");
        assertEquals("$x", x.toString());
        assertEquals("x", x.str());
        assertEquals(Name.of("x"), x);
        assertTrue(Name.of("a").compareTo(Name.of("b")) < 0);
        assertThrows(IllegalArgumentException.class, () -> Name.of(""));
    }

    @Test
    void functionTypeEqualityIncludesName() {
        FunctionType a = new FunctionType(Name.of("a"), I32, I32, I64);
        FunctionType a2 = new FunctionType(Name.of("a"), I32, I32, I64);
        FunctionType b = new FunctionType(Name.of("b"), I32, I32, I64);
        assertEquals(a, a2);
        assertEquals(a.hashCode(), a2.hashCode());
        assertNotEquals(a, b);
        assertNotEquals(a, new FunctionType(Name.of("a"), I32, I32));
    }
}
