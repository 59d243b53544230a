package infra.file;

import domain.error.CatalogAccessException;
import domain.plan.PlanReportRenderer;
import domain.plan.PlanTarget;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Serves a saved {@code DBMS_XPLAN} report (spooled from SQL*Plus, copied from an IDE, ...).
 *
 * <p>A history report holds one block per plan. Blocks start at a {@code SQL_ID ...} line, or at
 * the {@code Plan hash value: N} line when the report has no {@code SQL_ID} lines, and are
 * matched to groups by that plan hash value.</p>
 */
public final class TextFilePlanReportRenderer implements PlanReportRenderer {

    private static final Pattern PLAN_HASH = Pattern.compile("^\\s*Plan hash value:\\s*([0-9]+)");
    private static final Pattern SQL_ID = Pattern.compile("^SQL_ID\\b");

    private final String location;
    private List<String> cached;

    public TextFilePlanReportRenderer(String location) {
        this.location = location;
    }

    @Override
    public List<String> render(PlanTarget target, String groupKey) {
        List<String> all = lines();
        if (groupKey == null) return all;

        List<Block> blocks = split(all);
        if (blocks.size() == 1 && blocks.get(0).planHashValue == null) {
            // single, unlabelled plan
            return all;
        }

        for (Block b : blocks) {
            if (groupKey.equals(b.planHashValue)) return b.lines;
        }
        throw new CatalogAccessException("report " + location + " has no block for plan hash value " + groupKey);
    }

    static List<Block> split(List<String> lines) {
        boolean bySqlId = false;
        for (String l : lines) {
            if (SQL_ID.matcher(l).find()) {
                bySqlId = true;
                break;
            }
        }

        List<Block> blocks = new ArrayList<>();
        Block current = new Block();
        for (String l : lines) {
            boolean starts = bySqlId ? SQL_ID.matcher(l).find() : PLAN_HASH.matcher(l).find();
            if (starts && current.hasContent()) {
                blocks.add(current);
                current = new Block();
            }
            current.lines.add(l);
            Matcher m = PLAN_HASH.matcher(l);
            if (m.find() && current.planHashValue == null) {
                current.planHashValue = m.group(1);
            }
        }
        if (current.hasContent() || blocks.isEmpty()) blocks.add(current);
        return blocks;
    }

    private List<String> lines() {
        if (cached != null) return cached;
        List<String> out = new ArrayList<>();
        try (InputStream is = FileLocations.open(location, "plan report");
             BufferedReader r = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) out.add(line);
        } catch (IOException e) {
            throw new CatalogAccessException("Failed to read plan report: " + location, e);
        }
        cached = Collections.unmodifiableList(out);
        return cached;
    }

    static final class Block {
        final List<String> lines = new ArrayList<>();
        String planHashValue;

        boolean hasContent() {
            for (String l : lines) {
                if (!l.isBlank()) return true;
            }
            return false;
        }
    }
}
