package works.avlmap.grades;

import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Connects the {@link GradesShell} to the console when the application starts.
 */
@Component
@ConditionalOnProperty(
	prefix = "grades",
	name = "interactive",
	matchIfMissing = true)
@RequiredArgsConstructor
public class GradesRunner implements CommandLineRunner {
	private final GradesShell shell;

	@Override
	public void run(String... args) {
		shell.run(
			new InputStreamReader(System.in, UTF_8),
			new PrintWriter(new OutputStreamWriter(System.out, UTF_8), true));
	}
}
