package domain.plan;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GroupKeysTest {

    @Test
    void should_sort_plan_hash_values_numerically() {
        List<String> keys = new ArrayList<>(Arrays.asList("3512345678", "615168685", "42"));
        keys.sort(GroupKeys.ORDER);
        assertEquals(List.of("42", "615168685", "3512345678"), keys);
    }

    @Test
    void should_put_null_first_and_text_after_numbers() {
        List<String> keys = new ArrayList<>(Arrays.asList("beta", "7", null, "alpha"));
        keys.sort(GroupKeys.ORDER);
        assertEquals(Arrays.asList(null, "7", "alpha", "beta"), keys);
    }

    @Test
    void should_keep_zero_padded_keys_apart() {
        assertNotEquals(0, GroupKeys.compare("7", "007"));
        assertEquals(-Integer.signum(GroupKeys.compare("7", "007")), Integer.signum(GroupKeys.compare("007", "7")));

        List<String> keys = new ArrayList<>(Arrays.asList("8", "7", "007"));
        keys.sort(GroupKeys.ORDER);
        assertEquals(List.of("007", "7", "8"), keys);
    }

    @Test
    void should_treat_blank_group_key_as_absent() {
        assertNull(new PlanStep(0, null, " ", "", "  ").getGroupKey());
        assertNull(new PlanStep(0, null, " ", "", "  ").getObjectOwner());
        assertTrue(new PlanStep(0, null).isRoot());
    }
}
