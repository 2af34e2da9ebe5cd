package works.avlmap.grades;

import java.io.PrintWriter;
import java.io.Reader;
import java.util.Scanner;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.avlmap.AvlCursor;
import works.avlmap.AvlMap;

/**
 * Line-oriented command interpreter over a map from student name to grade.
 * Commands and their arguments are whitespace-separated tokens;
 * see {@link #USAGE}.
 */
@RequiredArgsConstructor
public class GradesShell {
	private final AvlMap<String, Integer> grades;
	private final String prompt;

	static final String USAGE = String.join(System.lineSeparator(),
		"Possible Commands:",
		"S - print the size of the map",
		"U <name> <grade> - update the grade for the name",
		"F <name> - check if the name is in the tree",
		"R <name> - remove the entry with the given name",
		"P - print all entries in the tree, ordered by key",
		"Q - stop");

	/**
	 * Executes commands until <code>Q</code> or the end of <code>input</code>.
	 */
	public void run(Reader input, PrintWriter output) {
		Scanner scanner = new Scanner(input);
		while (true) {
			output.print(prompt);
			output.flush();
			if (!scanner.hasNext()) {
				LOGGER.debug("End of input");
				return;
			}
			String command = scanner.next();
			LOGGER.debug("Command: {}", command);
			boolean keepGoing = switch (command) {
				case "S" -> {
					output.println(grades.size());
					yield true;
				}
				case "U" -> update(scanner, output);
				case "F" -> find(scanner, output);
				case "R" -> remove(scanner, output);
				case "P" -> {
					print(output);
					yield true;
				}
				case "Q" -> {
					output.println("stopping");
					yield false;
				}
				default -> {
					invalid(command, scanner, output);
					yield true;
				}
			};
			output.flush();
			if (!keepGoing) {
				return;
			}
		}
	}

	private boolean update(Scanner scanner, PrintWriter output) {
		if (!scanner.hasNext()) {
			return false;
		}
		String name = scanner.next();
		if (!scanner.hasNext()) {
			return false;
		}
		String gradeToken = scanner.next();
		int grade;
		try {
			grade = Integer.parseInt(gradeToken);
		} catch (NumberFormatException e) {
			LOGGER.warn("Rejected grade \"{}\" for {}", gradeToken, name);
			output.println("invalid grade: " + gradeToken);
			return true;
		}
		grades.update(name, grade);
		return true;
	}

	private boolean find(Scanner scanner, PrintWriter output) {
		if (!scanner.hasNext()) {
			return false;
		}
		String name = scanner.next();
		AvlCursor<String, Integer> entry = grades.find(name);
		if (entry.isEnd()) {
			output.println(name + " not found");
		} else {
			output.println(name + " found with grade " + entry.value());
		}
		return true;
	}

	private boolean remove(Scanner scanner, PrintWriter output) {
		if (!scanner.hasNext()) {
			return false;
		}
		String name = scanner.next();
		if (grades.hasKey(name)) {
			grades.remove(name);
		} else {
			output.println(name + " not found");
		}
		return true;
	}

	private void print(PrintWriter output) {
		output.println("Printing");
		for (AvlCursor<String, Integer> c = grades.begin(); !c.equals(grades.end()); c.advance()) {
			output.println(" - " + c.key() + " " + c.value());
		}
		output.println();
	}

	private void invalid(String command, Scanner scanner, PrintWriter output) {
		LOGGER.warn("Invalid command \"{}\"", command);
		output.println("invalid command");
		output.println(USAGE);
		if (scanner.hasNextLine()) {
			// Discard the rest of the line
			scanner.nextLine();
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(GradesShell.class);
}
