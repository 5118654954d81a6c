package io.github.eutro.wasmopt.test;

import io.github.eutro.wasmopt.ast.Nop;
import io.github.eutro.wasmopt.entity.Function;
import io.github.eutro.wasmopt.ext.CommonExts;
import io.github.eutro.wasmopt.ext.Ext;
import io.github.eutro.wasmopt.passes.InPlaceIRPass;
import io.github.eutro.wasmopt.walk.ExpressionWalker;
import io.github.eutro.wasmopt.ast.Expression;
import org.junit.jupiter.api.Test;

import static io.github.eutro.wasmopt.test.Utils.name;
import static io.github.eutro.wasmopt.types.WasmType.NONE;
import static org.junit.jupiter.api.Assertions.*;

public class ExtTest {
    private static final Ext<Integer> NOP_COUNT = Ext.create(Integer.class, "NOP_COUNT");
    private static final Ext<String> NOTE = Ext.create(String.class, "NOTE");

    @Test
    void attachAndRemove() {
        Nop nop = new Nop();
        assertNull(nop.getNullable(NOTE));
        assertFalse(nop.getExt(NOTE).isPresent());
        assertThrows(IllegalStateException.class, () -> nop.getExtOrThrow(NOTE));

        nop.attachExt(NOTE, "hello");
        assertEquals("hello", nop.getExtOrThrow(NOTE));
        assertEquals("hello", NOTE.getIn(nop).orElse(null));
        assertEquals(String.class, NOTE.getType());
        nop.removeExt(NOTE);
        assertNull(nop.getNullable(NOTE));
    }

    @Test
    void keysAreDistinctByIdentity() {
        Ext<String> otherNote = Ext.create(String.class, "NOTE");
        Nop nop = new Nop();
        nop.attachExt(NOTE, "mine");
        nop.attachExt(otherNote, "theirs");
        assertEquals("mine", nop.getExtOrThrow(NOTE));
        assertEquals("theirs", nop.getExtOrThrow(otherNote));
        nop.removeExt(NOTE);
        assertNull(nop.getNullable(NOTE));
        assertEquals("theirs", nop.getExtOrThrow(otherNote));
        assertFalse(Comparable.class.isAssignableFrom(Ext.class));
    }

    @Test
    void arenaExtsLiveInFields() {
        Nop nop = new Nop();
        nop.attachExt(CommonExts.ARENA_HANDLE, 12);
        assertEquals(12, nop.getHandle());
        assertEquals(Integer.valueOf(12), nop.getNullable(CommonExts.ARENA_HANDLE));
        nop.removeExt(CommonExts.ARENA_HANDLE);
        assertEquals(-1, nop.getHandle());
        assertNull(nop.getNullable(CommonExts.ARENA_HANDLE));
    }

    @Test
    void computedOnDemand() {
        InPlaceIRPass<Function> countNops = func -> {
            int[] count = {0};
            new ExpressionWalker() {
                @Override
                protected Expression walkNop(Nop curr) {
                    count[0]++;
                    return curr;
                }
            }.walk(func.body);
            func.attachExt(NOP_COUNT, count[0]);
        };
        Function func = new Function(name("f"), NONE, new Nop());
        assertEquals(1, (int) func.getExtOrRun(NOP_COUNT, func, countNops));
        func.body = null;
        assertEquals(1, (int) func.getExtOrRun(NOP_COUNT, func, countNops));
    }
}
