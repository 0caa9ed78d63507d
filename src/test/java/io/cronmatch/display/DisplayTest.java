package io.cronmatch.display;

import static org.junit.jupiter.api.Assertions.*;

import io.cronmatch.CronException;
import io.cronmatch.ast.CronFields;
import io.cronmatch.ast.Exact;
import io.cronmatch.ast.Field;
import io.cronmatch.parser.Parser;
import org.junit.jupiter.api.Test;

class DisplayTest {

  @Test
  void omitsYearWhenAbsent() throws CronException {
    assertEquals("*/5 0-6 * 1,7 *", Display.render(Parser.parse("*/5   0-6 * 1,7 *")));
  }

  @Test
  void includesYearWhenPresent() throws CronException {
    assertEquals("0 0 1 1 * 2031", Display.render(Parser.parse("0 0 1 1 * 2031")));
  }

  @Test
  void rendersReplacedYear() throws CronException {
    CronFields fields = Parser.parse("0 0 1 1 *").with(Field.YEAR, new Exact(2040));
    assertEquals("0 0 1 1 * 2040", Display.render(fields));
  }

  @Test
  void periodRendersStepNotPhase() throws CronException {
    assertEquals("* * */3 */2 *", Display.render(Parser.parse("* * */3 */2 *")));
  }
}
