package works.avlmap.grades;

import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.avlmap.AvlMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GradesShellTest {
	AvlMap<String, Integer> grades;

	@BeforeEach
	void setupGrades() {
		grades = AvlMap.natural();
	}

	@Test
	void updateAndPrint_sortedByName() {
		List<String> output = run("U zac 20 U amy 90 U mo 75 P Q");
		assertEquals(List.of(
			"Printing",
			" - amy 90",
			" - mo 75",
			" - zac 20",
			"",
			"stopping"
		), output);
	}

	@Test
	void size_countsDistinctNames() {
		List<String> output = run("S U a 1 U b 2 U a 3 S Q");
		assertEquals(List.of("0", "2", "stopping"), output);
		assertEquals(3, grades.at("a"));
	}

	@Test
	void find_reportsGradeOrAbsence() {
		List<String> output = run("U zac 20\nF zac\nF bob\nQ\n");
		assertEquals(List.of(
			"zac found with grade 20",
			"bob not found",
			"stopping"
		), output);
		assertFalse(grades.hasKey("bob"), "Lookup must not insert");
	}

	@Test
	void remove_missingNameReported() {
		List<String> output = run("U zac 20 R zac R zac S Q");
		assertEquals(List.of("zac not found", "0", "stopping"), output);
		assertTrue(grades.isEmpty());
	}

	@Test
	void invalidCommand_printsUsageAndSkipsLine() {
		List<String> output = run("X ignored U tokens\nS\nQ\n");
		List<String> expected = new ArrayList<>();
		expected.add("invalid command");
		expected.addAll(GradesShell.USAGE.lines().toList());
		expected.add("0");
		expected.add("stopping");
		assertEquals(expected, output);
	}

	@Test
	void invalidGrade_skipped() {
		List<String> output = run("U zac twenty S Q");
		assertEquals(List.of("invalid grade: twenty", "0", "stopping"), output);
	}

	@ParameterizedTest
	@ValueSource(strings = {"", "S", "U", "U zac", "F", "R"})
	void endOfInput_stopsQuietly(String input) {
		List<String> output = run(input);
		assertFalse(output.contains("stopping"));
	}

	@Test
	void quit_ignoresRemainingInput() {
		List<String> output = run("Q U zac 20");
		assertEquals(List.of("stopping"), output);
		assertTrue(grades.isEmpty());
	}

	@Test
	void prompt_printedBeforeEachCommand() {
		StringWriter out = new StringWriter();
		new GradesShell(grades, "> ").run(new StringReader("S Q"), new PrintWriter(out));
		assertEquals("> 0" + System.lineSeparator() + "> stopping" + System.lineSeparator(), out.toString());
	}

	private List<String> run(String input) {
		StringWriter out = new StringWriter();
		new GradesShell(grades, "").run(new StringReader(input), new PrintWriter(out));
		return out.toString().lines().toList();
	}
}
