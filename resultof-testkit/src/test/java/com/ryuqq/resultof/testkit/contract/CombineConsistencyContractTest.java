package com.ryuqq.resultof.testkit.contract;

import com.ryuqq.resultof.core.combine.Results;
import com.ryuqq.resultof.core.result.ResultOf;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: list combine agrees with the fixed-arity overloads.
 *
 * <p>For N in {2, 3, 4, 5}, combining the same inputs with an equivalent transform
 * must give the same result through the list form and the N-way overload. Every
 * combination of sample results is checked, so failure ordering is covered as well.</p>
 *
 * @author ResultOf Team
 * @since 1.0.0
 */
class CombineConsistencyContractTest extends AbstractResultContractTest {

    private static String join(List<Integer> values) {
        return values.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    private List<ResultOf<Integer, String>> inputs() {
        return List.of(ok(1), ok(2), err("a"), ok(3), err("b"));
    }

    @Test
    void testCombine_TwoWay_MatchesList() {
        for (ResultOf<Integer, String> r1 : inputs()) {
            for (ResultOf<Integer, String> r2 : inputs()) {
                ResultOf<String, String> fixed = Results.combine(r1, r2, (a, b) -> join(List.of(a, b)));
                ResultOf<String, String> listed = Results.combine(List.of(r1, r2), CombineConsistencyContractTest::join);

                assertEquals(listed, fixed, "2-way mismatch for " + r1 + ", " + r2);
            }
        }
    }

    @Test
    void testCombine_ThreeWay_MatchesList() {
        for (ResultOf<Integer, String> r1 : inputs()) {
            for (ResultOf<Integer, String> r2 : inputs()) {
                for (ResultOf<Integer, String> r3 : inputs()) {
                    ResultOf<String, String> fixed = Results.combine(r1, r2, r3,
                            (a, b, c) -> join(List.of(a, b, c)));
                    ResultOf<String, String> listed = Results.combine(List.of(r1, r2, r3),
                            CombineConsistencyContractTest::join);

                    assertEquals(listed, fixed, "3-way mismatch for " + List.of(r1, r2, r3));
                }
            }
        }
    }

    @Test
    void testCombine_FourWay_MatchesList() {
        for (List<ResultOf<Integer, String>> row : rows(4)) {
            ResultOf<String, String> fixed = Results.combine(row.get(0), row.get(1), row.get(2), row.get(3),
                    (a, b, c, d) -> join(List.of(a, b, c, d)));
            ResultOf<String, String> listed = Results.combine(row, CombineConsistencyContractTest::join);

            assertEquals(listed, fixed, "4-way mismatch for " + row);
        }
    }

    @Test
    void testCombine_FiveWay_MatchesList() {
        for (List<ResultOf<Integer, String>> row : rows(5)) {
            ResultOf<String, String> fixed = Results.combine(row.get(0), row.get(1), row.get(2), row.get(3), row.get(4),
                    (a, b, c, d, e) -> join(List.of(a, b, c, d, e)));
            ResultOf<String, String> listed = Results.combine(row, CombineConsistencyContractTest::join);

            assertEquals(listed, fixed, "5-way mismatch for " + row);
        }
    }

    @Test
    void testFlatCombine_FiveWay_MatchesList() {
        for (List<ResultOf<Integer, String>> row : rows(5)) {
            ResultOf<Integer, String> fixed = Results.flatCombine(
                    row.get(0), row.get(1), row.get(2), row.get(3), row.get(4),
                    (a, b, c, d, e) -> a + b + c + d + e > 10 ? ok(a + b + c + d + e) : err("small"));
            ResultOf<Integer, String> listed = Results.flatCombine(row, values -> {
                int sum = values.stream().mapToInt(Integer::intValue).sum();
                return sum > 10 ? ok(sum) : err("small");
            });

            assertEquals(listed, fixed, "5-way flatCombine mismatch for " + row);
        }
    }

    /**
     * All rows of the given width drawn from {@link #inputs()}.
     */
    private List<List<ResultOf<Integer, String>>> rows(int width) {
        List<List<ResultOf<Integer, String>>> rows = new ArrayList<>();
        rows.add(List.of());
        for (int i = 0; i < width; i++) {
            List<List<ResultOf<Integer, String>>> next = new ArrayList<>();
            for (List<ResultOf<Integer, String>> row : rows) {
                for (ResultOf<Integer, String> input : inputs()) {
                    List<ResultOf<Integer, String>> extended = new ArrayList<>(row);
                    extended.add(input);
                    next.add(extended);
                }
            }
            rows = next;
        }
        return rows;
    }
}
