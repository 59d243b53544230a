package infra.file;

import domain.error.CatalogAccessException;
import domain.plan.PlanStep;
import domain.plan.PlanStepCatalog;
import domain.plan.PlanTarget;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Plan rows from a CSV export ({@code SELECT id, parent_id, object_owner, object_name, ...}).
 *
 * <p>The first record is read as the header by hand (not {@code setHeader()}) so that blank or
 * duplicated titles from spreadsheet exports do not fail the parse.</p>
 */
public final class CsvPlanStepCatalog implements PlanStepCatalog {

    private final String location;

    public CsvPlanStepCatalog(String location) {
        this.location = location;
    }

    @Override
    public List<PlanStep> fetch(PlanTarget target) {
        try (InputStream is = FileLocations.open(location, "plan catalog csv");
             InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8);
             CSVParser parser = CSVFormat.DEFAULT
                     .builder()
                     .setTrim(true)
                     .setIgnoreEmptyLines(true)
                     .build()
                     .parse(reader)) {

            Iterator<CSVRecord> it = parser.iterator();
            if (!it.hasNext()) return Collections.emptyList();

            PlanStepColumns columns = PlanStepColumns.fromHeader(values(it.next()), location);

            List<PlanStep> out = new ArrayList<>();
            int rowNo = 1;
            while (it.hasNext()) {
                rowNo++;
                PlanStep s = columns.toStep(values(it.next()), rowNo);
                if (s != null) out.add(s);
            }
            return PlanStepColumns.filter(out, target);

        } catch (IOException e) {
            throw new CatalogAccessException("Failed to read plan catalog csv: " + location, e);
        }
    }

    private static List<String> values(CSVRecord r) {
        List<String> v = new ArrayList<>(r.size());
        for (int i = 0; i < r.size(); i++) v.add(r.get(i));
        return v;
    }
}
