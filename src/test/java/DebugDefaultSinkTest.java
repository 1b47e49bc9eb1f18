import com.pale.debug.Debug;
import com.pale.script.PaleCli;
import com.pale.script.PaleScript;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/** Nothing here installs or resets a sink: the engine must log into the default one. */
public class DebugDefaultSinkTest {

    @Test
    void defaultSink_isInstalled() {
        assertNotNull(Debug.get().getSink());
        assertDoesNotThrow(() -> Debug.get().t("T", "trace into the default sink"));
    }

    @Test
    void engineRuns_withDefaultSink() {
        PaleScript ps = new PaleScript();
        ps.setOutput(new PrintStream(new ByteArrayOutputStream()));

        assertEquals("69", ps.run("(+ 34 35)").output());
        assertEquals("2", ps.run("(let ((x 1)) (+ x 1))").output());
    }

    @Test
    void cliCommand_withDefaultSink() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        int code = PaleCli.run(new String[]{"-c", "(+ 34 35)"},
                new ByteArrayInputStream(new byte[0]),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(0, code, () -> err.toString(StandardCharsets.UTF_8));
        assertEquals("69" + System.lineSeparator(), out.toString(StandardCharsets.UTF_8));
    }
}
