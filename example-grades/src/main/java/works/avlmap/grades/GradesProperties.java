package works.avlmap.grades;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings under the <code>grades</code> prefix.
 *
 * @param interactive whether to run {@link GradesShell} on standard input at startup
 * @param prompt printed before each command is read
 */
@ConfigurationProperties(prefix = "grades")
public record GradesProperties(
	@DefaultValue("true") boolean interactive,
	String prompt
) {
	public GradesProperties {
		if (prompt == null) {
			prompt = "";
		}
	}
}
