package infra.file;

import domain.error.CatalogAccessException;
import domain.plan.PlanStep;
import domain.plan.PlanTarget;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Header handling shared by the CSV and XLSX catalogs.
 *
 * <p>Accepted titles (case-insensitive, {@code -}/space treated as {@code _}):</p>
 * <ul>
 *   <li>id: {@code id}, {@code step_id}, {@code operation_id}</li>
 *   <li>parent: {@code parent_id}, {@code pid}, {@code parent}</li>
 *   <li>owner: {@code object_owner}, {@code owner}</li>
 *   <li>name: {@code object_name}, {@code name}</li>
 *   <li>group: {@code group_key}, {@code plan_hash_value}, {@code phv}</li>
 * </ul>
 */
final class PlanStepColumns {

    private static final String[] ID = {"id", "step_id", "operation_id"};
    private static final String[] PARENT = {"parent_id", "pid", "parent"};
    private static final String[] OWNER = {"object_owner", "owner"};
    private static final String[] NAME = {"object_name", "name"};
    private static final String[] GROUP = {"group_key", "plan_hash_value", "phv"};

    private final String source;
    private final int id;
    private final int parent;
    private final int owner;
    private final int name;
    private final int group;

    private PlanStepColumns(String source, int id, int parent, int owner, int name, int group) {
        this.source = source;
        this.id = id;
        this.parent = parent;
        this.owner = owner;
        this.name = name;
        this.group = group;
    }

    /** @throws CatalogAccessException when {@code id} or {@code parent_id} is missing */
    static PlanStepColumns fromHeader(List<String> headers, String source) {
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            index.putIfAbsent(norm(headers.get(i)), i);
        }

        int id = first(index, ID);
        int parent = first(index, PARENT);
        if (id < 0 || parent < 0) {
            throw new CatalogAccessException(source + ": header must contain id and parent_id, found " + headers);
        }
        return new PlanStepColumns(source, id, parent, first(index, OWNER), first(index, NAME), first(index, GROUP));
    }

    /**
     * Converts one row; {@code null} for a blank row.
     *
     * @param rowNo 1-based row number for messages
     */
    PlanStep toStep(List<String> cells, int rowNo) {
        String rawId = cell(cells, id);
        String rawParent = cell(cells, parent);
        if (rawId.isEmpty() && rawParent.isEmpty() && allBlank(cells)) return null;

        Integer stepId = parseInt(rawId, "id", rowNo);
        if (stepId == null) {
            throw new CatalogAccessException(source + " row " + rowNo + ": id is empty");
        }
        Integer parentId = parseInt(rawParent, "parent_id", rowNo);

        return new PlanStep(stepId, parentId, cell(cells, owner), cell(cells, name), cell(cells, group));
    }

    /** History targets with a plan hash value only keep that plan's rows. */
    static List<PlanStep> filter(List<PlanStep> steps, PlanTarget target) {
        if (target == null || target.getPlanHashValue() == null) return steps;
        String wanted = String.valueOf(target.getPlanHashValue());
        List<PlanStep> out = new ArrayList<>(steps.size());
        for (PlanStep s : steps) {
            if (s.getGroupKey() == null || wanted.equals(s.getGroupKey())) out.add(s);
        }
        return out;
    }

    private Integer parseInt(String raw, String column, int rowNo) {
        if (raw.isEmpty()) return null;
        String v = raw;
        // spreadsheets hand numbers back as "3.0"
        if (v.endsWith(".0")) v = v.substring(0, v.length() - 2);
        try {
            return Integer.valueOf(v);
        } catch (NumberFormatException e) {
            throw new CatalogAccessException(source + " row " + rowNo + ": " + column + " is not an integer: '" + raw + "'", e);
        }
    }

    private static String cell(List<String> cells, int idx) {
        if (idx < 0 || idx >= cells.size()) return "";
        String v = cells.get(idx);
        return v == null ? "" : v.trim();
    }

    private static boolean allBlank(List<String> cells) {
        for (String c : cells) {
            if (c != null && !c.isBlank()) return false;
        }
        return true;
    }

    private static int first(Map<String, Integer> index, String[] candidates) {
        for (String c : candidates) {
            Integer i = index.get(c);
            if (i != null) return i;
        }
        return -1;
    }

    static String norm(String header) {
        if (header == null) return "";
        String h = header;
        if (!h.isEmpty() && h.charAt(0) == '\uFEFF') h = h.substring(1);
        return h.trim()
                .toLowerCase(Locale.ROOT)
                .replace('-', '_')
                .replace(' ', '_');
    }
}
