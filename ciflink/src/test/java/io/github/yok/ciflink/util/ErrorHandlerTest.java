package io.github.yok.ciflink.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.ciflink.validation.ContentValidationException;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ErrorHandlerTest {

    @AfterEach
    void tearDown() {
        ErrorHandler.restoreExitForCurrentThread();
    }

    private static String captureErr(Runnable action) {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            action.run();
        } finally {
            System.setErr(originalErr);
        }
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void errorAndExit_異常ケース_exit無効を指定する_IllegalStateExceptionが送出されること() {
        ErrorHandler.disableExitForCurrentThread();
        RuntimeException cause = new RuntimeException("root");

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> ErrorHandler.errorAndExit("boom", cause));
        assertEquals("boom", ex.getMessage());
        assertSame(cause, ex.getCause());

        IllegalStateException ex2 = assertThrows(IllegalStateException.class,
                () -> ErrorHandler.errorAndExit("boom2"));
        assertEquals("boom2", ex2.getMessage());
        assertEquals(ErrorHandler.FAILURE_STATUS, ErrorHandler.exitStatus());
    }

    @Test
    void errorAndExit_正常ケース_exit有効でThrowableありを指定する_標準エラーへ出力されること() {
        String message = captureErr(
                () -> ErrorHandler.errorAndExit("boom", new RuntimeException("root")));

        assertTrue(message.contains("ERROR: boom"));
        assertTrue(message.contains("root"));
        assertEquals(ErrorHandler.FAILURE_STATUS, ErrorHandler.exitStatus());
    }

    @Test
    void errorAndExit_正常ケース_変換例外を指定する_違反が一行ずつ出力されること() {
        ContentValidationException cause =
                new ContentValidationException(Arrays.asList("first violation", "second one"));

        String message = captureErr(() -> ErrorHandler.errorAndExit("Fatal error", cause));

        assertTrue(message.contains("ERROR: Fatal error"));
        assertTrue(message.contains("  - first violation"));
        assertTrue(message.contains("  - second one"));
    }

    @Test
    void errorAndExit_正常ケース_exit有効でメッセージのみを指定する_例外が送出されないこと() {
        String message = captureErr(() -> ErrorHandler.errorAndExit("boom2"));

        assertTrue(message.contains("ERROR: boom2"));
    }

    @Test
    void restoreExitForCurrentThread_正常ケース_エラー後に復元する_終了ステータスが0に戻ること() {
        captureErr(() -> ErrorHandler.errorAndExit("boom"));
        assertEquals(1, ErrorHandler.exitStatus());

        ErrorHandler.restoreExitForCurrentThread();

        assertEquals(0, ErrorHandler.exitStatus());
        assertFalse(captureErr(() -> ErrorHandler.errorAndExit("again")).isEmpty());
    }

    @Test
    void constructor_異常ケース_リフレクションで生成する_AssertionErrorが送出されること()
            throws Exception {
        Constructor<ErrorHandler> ctor = ErrorHandler.class.getDeclaredConstructor();
        ctor.setAccessible(true);

        InvocationTargetException ex =
                assertThrows(InvocationTargetException.class, ctor::newInstance);
        assertTrue(ex.getCause() instanceof AssertionError);
    }
}
