package com.funcplan;

import com.funcplan.plan.FunctionPlan;
import com.funcplan.plan.PlanBuilder;
import com.funcplan.render.PseudocodeRenderer;
import com.funcplan.syntax.ParsedFunction;
import com.funcplan.syntax.SourceAnalyzer;
import org.junit.jupiter.api.Test;

import static com.funcplan.PlanFixtures.planOf;
import static org.junit.jupiter.api.Assertions.*;

class PseudocodeRendererTest {

    private final PseudocodeRenderer renderer = new PseudocodeRenderer();

    private static FunctionPlan workflow(String name) {
        ParsedFunction parsed = new SourceAnalyzer().analyze(PlanFixtures.ORDER_WORKFLOW, name);
        return new PlanBuilder().build(parsed.function(), parsed.statements());
    }

    @Test
    void rendersFixturePlan() {
        String expected = String.join("\n",
                "FUNCTION plan(List<String>, int)",
                "  SET int total = 0",
                "  CALL audit.clear()",
                "  FOR order : orders",
                "    IF order.isEmpty()",
                "      CONTINUE",
                "    END IF",
                "    IF total >= limit",
                "      BREAK",
                "    END IF",
                "    TRY",
                "      SET total += parse(order)",
                "      CALL audit.add(order)",
                "    EXCEPT NumberFormatException e",
                "      CALL audit.add(\"rejected \" + order)",
                "    FINALLY",
                "      SET processed++",
                "    END TRY",
                "  END FOR",
                "  IF total == 0",
                "    RAISE new IllegalStateException(\"nothing processed\")",
                "  END IF",
                "  RETURN total",
                "END FUNCTION",
                "");
        assertEquals(expected, renderer.render(workflow("plan")));
    }

    @Test
    void explicitElseIsRendered() {
        assertEquals("FUNCTION classify(int)\n"
                + "  IF x > 0\n"
                + "    RETURN 1\n"
                + "  ELSE\n"
                + "    RETURN 2\n"
                + "  END IF\n"
                + "END FUNCTION\n", renderer.render(workflow("classify")));
    }

    @Test
    void placeholderBecomesComment() {
        String text = renderer.render(workflow("dispatch"));
        assertTrue(text.contains("\n  # <unsupported: SwitchStatement>\n"), text);
    }

    @Test
    void whileLoopWithBareReturn() {
        String text = renderer.render(workflow("drain"));
        assertTrue(text.contains("  WHILE !queue.isEmpty()\n"), text);
        assertTrue(text.contains("      RETURN\n"), text);
        assertTrue(text.contains("  END WHILE\n"), text);
    }

    @Test
    void emptyRegionsRenderPass() {
        String text = renderer.render(planOf("while (x > 0) { }\ntry (var in = open()) { } catch (Exception e) { }"));
        assertEquals("FUNCTION target(int, int, List<String>)\n"
                + "  WHILE x > 0\n"
                + "    PASS\n"
                + "  END WHILE\n"
                + "  TRY (var in = open())\n"
                + "    PASS\n"
                + "  EXCEPT Exception e\n"
                + "    PASS\n"
                + "  END TRY\n"
                + "END FUNCTION\n", text);
    }

    @Test
    void labelledLoopShowsItsName() {
        String text = renderer.render(planOf(
                "outer: while (x > 0) { for (String s : items) { if (s.isEmpty()) { continue outer; } } }"));
        assertEquals("FUNCTION target(int, int, List<String>)\n"
                + "  outer: WHILE x > 0\n"
                + "    FOR s : items\n"
                + "      IF s.isEmpty()\n"
                + "        CONTINUE outer\n"
                + "      END IF\n"
                + "    END FOR\n"
                + "  END WHILE\n"
                + "END FUNCTION\n", text);
    }

    @Test
    void renderingIsIdempotent() {
        FunctionPlan plan = workflow("plan");
        assertEquals(renderer.render(plan), renderer.render(plan));
        assertEquals(renderer.render(plan), new PseudocodeRenderer().render(workflow("plan")));
    }
}
