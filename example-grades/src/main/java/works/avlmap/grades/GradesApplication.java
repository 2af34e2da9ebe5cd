package works.avlmap.grades;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import works.avlmap.AvlMap;

@SpringBootApplication
@EnableConfigurationProperties(GradesProperties.class)
public class GradesApplication {

	public static void main(String[] args) {
		SpringApplication.run(GradesApplication.class, args);
	}

	@Bean
	AvlMap<String, Integer> grades() {
		return AvlMap.natural();
	}

	@Bean
	GradesShell gradesShell(AvlMap<String, Integer> grades, GradesProperties properties) {
		return new GradesShell(grades, properties.prompt());
	}
}
