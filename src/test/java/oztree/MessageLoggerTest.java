package oztree;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import org.junit.Test;

public class MessageLoggerTest {

	private static String[] emit(MessageLogger logger) throws Exception {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		logger.setPrintStream(new PrintStream(bytes, true, "UTF-8"));
		logger.message("start");
		logger.indentKeyValue(2, "Amorphea", 50);
		logger.indentKeyValue(1, "Fungi", null);
		logger.close();
		return bytes.toString("UTF-8").split("\\r?\\n");
	}

	@Test
	public void testWithoutPrefix() throws Exception {
		assertArrayEquals(new String[] {"start", "    Amorphea: 50", "  Fungi: null"}, emit(new MessageLogger("")));
	}

	@Test
	public void testWithPrefix() throws Exception {
		assertArrayEquals(new String[] {"build|start", "build|    Amorphea: 50", "build|  Fungi: null"},
				emit(new MessageLogger("build", "|")));
	}
}
