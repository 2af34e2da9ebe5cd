package works.avlmap.grades;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import works.avlmap.AvlMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(
	classes = GradesApplication.class,
	properties = {
		"grades.interactive=false",
		"grades.prompt=grades>"
	})
class GradesApplicationTest {
	@Autowired
	ApplicationContext context;

	@Autowired
	GradesProperties properties;

	@Autowired
	AvlMap<String, Integer> grades;

	@Test
	void properties_bound() {
		assertFalse(properties.interactive());
		assertEquals("grades>", properties.prompt());
	}

	@Test
	void nonInteractive_noRunner() {
		assertTrue(context.getBeansOfType(GradesRunner.class).isEmpty());
		assertEquals(1, context.getBeansOfType(GradesShell.class).size());
	}

	@Test
	void grades_startEmpty() {
		assertTrue(grades.isEmpty());
	}
}
