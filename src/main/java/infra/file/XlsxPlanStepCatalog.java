package infra.file;

import domain.error.CatalogAccessException;
import domain.plan.PlanStep;
import domain.plan.PlanStepCatalog;
import domain.plan.PlanTarget;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Plan rows from the first sheet of an XLSX workbook; same columns as {@link CsvPlanStepCatalog}.
 */
public final class XlsxPlanStepCatalog implements PlanStepCatalog {

    private final String location;
    private final DataFormatter formatter = new DataFormatter();

    public XlsxPlanStepCatalog(String location) {
        this.location = location;
    }

    @Override
    public List<PlanStep> fetch(PlanTarget target) {
        try (InputStream is = FileLocations.open(location, "plan catalog xlsx");
             Workbook wb = new XSSFWorkbook(is)) {

            if (wb.getNumberOfSheets() == 0) return Collections.emptyList();
            Sheet sheet = wb.getSheetAt(0);

            PlanStepColumns columns = null;
            List<PlanStep> out = new ArrayList<>();

            for (Row row : sheet) {
                List<String> cells = values(row);
                if (columns == null) {
                    // first row: header
                    columns = PlanStepColumns.fromHeader(cells, location);
                    continue;
                }
                PlanStep s = columns.toStep(cells, row.getRowNum() + 1);
                if (s != null) out.add(s);
            }
            return PlanStepColumns.filter(out, target);

        } catch (IOException e) {
            throw new CatalogAccessException("Failed to read plan catalog xlsx: " + location, e);
        }
    }

    private List<String> values(Row row) {
        int last = Math.max(0, row.getLastCellNum());
        List<String> v = new ArrayList<>(last);
        for (int i = 0; i < last; i++) {
            Cell cell = row.getCell(i);
            v.add(cell == null ? "" : formatter.formatCellValue(cell).trim());
        }
        return v;
    }
}
