package org.modelplatform.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.modelplatform.api.exceptions.ItemNotFoundException;
import org.modelplatform.api.exceptions.ValidationException;
import org.modelplatform.api.item.IndexSetData;
import org.modelplatform.api.item.ItemData;
import org.modelplatform.api.item.ItemRow;
import org.modelplatform.api.item.ItemType;
import org.modelplatform.api.item.ScalarData;
import org.modelplatform.api.item.TableData;
import org.modelplatform.core.Platform;
import org.modelplatform.core.Scenario;
import org.modelplatform.core.input.ElementInput;
import org.modelplatform.core.input.FieldInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes the items of a scenario as an xlsx workbook.
 * <p>
 * Layout:
 * <ul>
 *   <li>one sheet per item, named like the item; a plain index set has a single column headed
 *       by its own name, other items one column per index name followed by {@code value, unit}
 *       or {@code lvl, mrg}</li>
 *   <li>a sheet {@value #MAPPING_SHEET} listing every written item with its kind, index sets
 *       and index names</li>
 * </ul>
 * Empty parameters, variables and equations are not written; empty sets are.
 */
public final class ScenarioWorkbook {

    private static final Logger log = LoggerFactory.getLogger(ScenarioWorkbook.class);

    public static final String MAPPING_SHEET = "ix_type_mapping";

    static final String ITEM = "item";
    static final String TYPE = "ix_type";
    static final String INDEX_SETS = "idx_sets";
    static final String INDEX_NAMES = "idx_names";

    private static final String VALUE = "value";
    private static final String UNIT = "unit";
    private static final String SEPARATOR = ",";
    private static final List<ItemType> KINDS = List.of(ItemType.SET, ItemType.PAR, ItemType.VAR, ItemType.EQU);

    private ScenarioWorkbook() {
    }

    /**
     * Options of {@link #read(Scenario, Path, ReadOptions)}.
     *
     * @param addUnits    define units used by parameters that the platform does not know yet
     * @param initItems   declare sets and parameters missing in the scenario
     * @param commitSteps commit after the sets and after every parameter
     */
    public record ReadOptions(boolean addUnits, boolean initItems, boolean commitSteps) {

        public static ReadOptions defaults() {
            return new ReadOptions(false, false, false);
        }
    }

    // ==================== Write ====================

    /**
     * Writes all sets, parameters, variables and equations of {@code scenario}.
     *
     * @throws ValidationException if an item name is not a valid sheet name
     */
    public static void write(Scenario scenario, Path path) throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Map<String, ItemType> written = new LinkedHashMap<>();
            for (ItemType type : KINDS) {
                for (String name : scenario.listItems(type)) {
                    ItemData data = read(scenario, type, name);
                    if (type != ItemType.SET && data.size() == 0) {
                        continue;
                    }
                    writeItem(workbook.createSheet(sheetName(name)), data);
                    written.put(name, type);
                }
            }
            writeMapping(workbook.createSheet(MAPPING_SHEET), scenario, written);

            try (OutputStream out = Files.newOutputStream(path)) {
                workbook.write(out);
            }
            log.debug("Wrote {} items of {} to {}", written.size(), scenario, path);
        }
    }

    private static ItemData read(Scenario scenario, ItemType type, String name) {
        return switch (type) {
            case SET -> scenario.set(name);
            case PAR -> scenario.par(name);
            case VAR -> scenario.var(name);
            case EQU -> scenario.equ(name);
            case TS -> throw new IllegalArgumentException("Time series are not items");
        };
    }

    private static String sheetName(String name) {
        try {
            WorkbookUtil.validateSheetName(name);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Item '" + name + "' cannot be written to a workbook: " + e.getMessage(), e);
        }
        return name;
    }

    private static void writeItem(Sheet sheet, ItemData data) {
        if (data instanceof IndexSetData set) {
            writeRow(sheet, 0, List.of(sheet.getSheetName()));
            int r = 1;
            for (String key : set.keys()) {
                writeRow(sheet, r++, List.of(key));
            }
        } else if (data instanceof ScalarData scalar) {
            if (scalar.type().isSolution()) {
                writeRow(sheet, 0, List.of("lvl", "mrg"));
                writeRow(sheet, 1, Arrays.asList(scalar.level(), scalar.marginal()));
            } else {
                writeRow(sheet, 0, List.of(VALUE, UNIT));
                writeRow(sheet, 1, Arrays.asList(scalar.value(), scalar.unit()));
            }
        } else if (data instanceof TableData table) {
            writeRow(sheet, 0, new ArrayList<>(table.columns()));
            int r = 1;
            for (ItemRow row : table.rows()) {
                List<Object> cells = new ArrayList<>(row.key());
                switch (table.type()) {
                    case PAR -> {
                        cells.add(row.value());
                        cells.add(row.unit());
                    }
                    case VAR, EQU -> {
                        cells.add(row.level());
                        cells.add(row.marginal());
                    }
                    case SET, TS -> {
                        // keys only
                    }
                }
                writeRow(sheet, r++, cells);
            }
        }
    }

    private static void writeMapping(Sheet sheet, Scenario scenario, Map<String, ItemType> written) {
        writeRow(sheet, 0, List.of(ITEM, TYPE, INDEX_SETS, INDEX_NAMES));
        int r = 1;
        for (Map.Entry<String, ItemType> entry : written.entrySet()) {
            String name = entry.getKey();
            writeRow(sheet, r++, List.of(name, entry.getValue().name().toLowerCase(Locale.ROOT),
                    String.join(SEPARATOR, scenario.idxSets(name)),
                    String.join(SEPARATOR, scenario.idxNames(name))));
        }
    }

    private static void writeRow(Sheet sheet, int index, List<?> values) {
        Row row = sheet.createRow(index);
        for (int c = 0; c < values.size(); c++) {
            Object value = values.get(c);
            if (value == null) {
                continue;
            }
            Cell cell = row.createCell(c);
            if (value instanceof Number number) {
                cell.setCellValue(number.doubleValue());
            } else {
                cell.setCellValue(value.toString());
            }
        }
    }

    // ==================== Read ====================

    /**
     * Adds the sets and parameters of a workbook written by {@link #write(Scenario, Path)} to
     * {@code scenario}, which must be checked out. Variables and equations are skipped.
     *
     * @throws ValidationException   if the workbook has no {@value #MAPPING_SHEET} sheet, a sheet is
     *                               missing or an existing item has different index sets
     * @throws ItemNotFoundException if an item does not exist and {@code initItems} is off
     */
    public static void read(Scenario scenario, Path path, ReadOptions options) throws IOException {
        log.info("Reading data from {}", path);
        try (InputStream in = Files.newInputStream(path); Workbook workbook = new XSSFWorkbook(in)) {
            Sheet mappingSheet = workbook.getSheet(MAPPING_SHEET);
            if (mappingSheet == null) {
                throw new ValidationException("No sheet '" + MAPPING_SHEET + "' in " + path);
            }
            List<MappingEntry> mapping = readMapping(mappingSheet);

            List<SheetData> indexSets = new ArrayList<>();
            List<SheetData> indexedSets = new ArrayList<>();
            for (MappingEntry entry : mapping) {
                if (entry.type() != ItemType.SET) {
                    continue;
                }
                SheetData data = sheet(workbook, entry, path);
                if (data.indexSets().isEmpty()) {
                    indexSets.add(data);
                } else {
                    indexedSets.add(data);
                }
            }
            for (SheetData set : indexSets) {
                addSet(scenario, set, options, path);
            }
            for (SheetData set : indexedSets) {
                addSet(scenario, set, options, path);
            }
            if (options.commitSteps()) {
                scenario.commit("Loaded sets from " + path);
                scenario.checkOut();
            }

            Set<String> units = options.addUnits() ? new HashSet<>(scenario.platform().units()) : Set.of();
            for (MappingEntry entry : mapping) {
                if (entry.type() == ItemType.SET) {
                    continue;
                }
                if (entry.type() != ItemType.PAR) {
                    log.info("Cannot import {} '{}'", entry.type().displayName(), entry.name());
                    continue;
                }
                SheetData data = sheet(workbook, entry, path);
                if (options.addUnits()) {
                    addMissingUnits(scenario.platform(), units, data);
                }
                addParameter(scenario, data, options, path);
                if (options.commitSteps()) {
                    scenario.commit("Loaded parameter '" + entry.name() + "' from " + path);
                    scenario.checkOut();
                }
            }
        }
    }

    private static void addSet(Scenario scenario, SheetData set, ReadOptions options, Path path) {
        if (options.initItems()) {
            initIfMissing(scenario, set, path);
        }
        if (set.rows().isEmpty()) {
            return;
        }
        ElementInput keys;
        if (set.indexSets().isEmpty()) {
            List<String> elements = new ArrayList<>(set.rows().size());
            for (List<String> row : set.rows()) {
                elements.add(row.get(0));
            }
            keys = ElementInput.keys(elements);
        } else {
            keys = ElementInput.keys(keyColumns(set, set.indexSets().size()));
        }
        try {
            scenario.addSet(set.name(), keys);
        } catch (ItemNotFoundException e) {
            throw new ItemNotFoundException("No set '" + set.name() + "' in " + scenario
                    + "; read with initItems to declare it", e);
        }
    }

    private static void addParameter(Scenario scenario, SheetData par, ReadOptions options, Path path) {
        if (options.initItems()) {
            initIfMissing(scenario, par, path);
        }
        if (par.rows().isEmpty()) {
            return;
        }
        int dimension = par.indexSets().size();
        int valueColumn = par.header().indexOf(VALUE);
        int unitColumn = par.header().indexOf(UNIT);
        if (valueColumn < 0) {
            throw new ValidationException("Sheet '" + par.name() + "' has no '" + VALUE + "' column");
        }
        List<Double> values = new ArrayList<>(par.rows().size());
        List<String> units = new ArrayList<>(par.rows().size());
        for (List<String> row : par.rows()) {
            values.add(number(par.name(), cell(row, valueColumn)));
            units.add(unitColumn < 0 ? null : cell(row, unitColumn));
        }
        try {
            if (dimension == 0) {
                scenario.addPar(par.name(), ElementInput.none(), FieldInput.of(values.get(0)),
                        FieldInput.of(units.get(0)), FieldInput.none());
            } else {
                scenario.addPar(par.name(), ElementInput.keys(keyColumns(par, dimension)), FieldInput.each(values),
                        FieldInput.each(units), FieldInput.none());
            }
        } catch (ItemNotFoundException e) {
            throw new ItemNotFoundException("No parameter '" + par.name() + "' in " + scenario
                    + "; read with initItems to declare it", e);
        }
    }

    private static void addMissingUnits(Platform platform, Set<String> known, SheetData par) {
        int unitColumn = par.header().indexOf(UNIT);
        if (unitColumn < 0) {
            return;
        }
        for (List<String> row : par.rows()) {
            String unit = cell(row, unitColumn);
            if (unit != null && known.add(unit)) {
                log.info("Add missing unit: {}", unit);
                platform.addUnit(unit, "Loaded from file");
            }
        }
    }

    private static void initIfMissing(Scenario scenario, SheetData item, Path path) {
        if (scenario.hasItem(item.name())) {
            List<String> existing = scenario.idxSets(item.name());
            if (!existing.equals(item.indexSets())) {
                throw new ValidationException(item.type().displayName() + " '" + item.name() + "' has index sets "
                        + existing + " in " + scenario + "; " + item.indexSets() + " in " + path);
            }
            return;
        }
        scenario.initItem(item.type(), item.name(), item.indexSets(),
                item.indexNames().isEmpty() ? null : item.indexNames());
    }

    private static List<List<String>> keyColumns(SheetData item, int dimension) {
        List<List<String>> keys = new ArrayList<>(item.rows().size());
        for (List<String> row : item.rows()) {
            List<String> key = new ArrayList<>(dimension);
            for (int c = 0; c < dimension; c++) {
                key.add(cell(row, c));
            }
            keys.add(key);
        }
        return keys;
    }

    // ==================== Sheets ====================

    private record MappingEntry(String name, ItemType type, List<String> indexSets, List<String> indexNames) {
    }

    /**
     * Cell text of one item sheet; {@code indexSets} and {@code indexNames} come from the mapping
     * sheet or, for older workbooks, from the header.
     */
    private record SheetData(String name, ItemType type, List<String> indexSets, List<String> indexNames,
                             List<String> header, List<List<String>> rows) {
    }

    private static List<MappingEntry> readMapping(Sheet sheet) {
        List<List<String>> rows = rows(sheet);
        if (rows.isEmpty()) {
            return List.of();
        }
        List<String> header = rows.get(0);
        int item = header.indexOf(ITEM);
        int type = header.indexOf(TYPE);
        if (item < 0 || type < 0) {
            throw new ValidationException("Sheet '" + MAPPING_SHEET + "' needs columns '" + ITEM + "' and '" + TYPE
                    + "', got " + header);
        }
        int sets = header.indexOf(INDEX_SETS);
        int names = header.indexOf(INDEX_NAMES);
        List<MappingEntry> entries = new ArrayList<>();
        for (List<String> row : rows.subList(1, rows.size())) {
            String name = cell(row, item);
            if (name == null) {
                continue;
            }
            entries.add(new MappingEntry(name, ItemType.fromName(cell(row, type)),
                    sets < 0 ? null : split(cell(row, sets)), names < 0 ? null : split(cell(row, names))));
        }
        return entries;
    }

    private static SheetData sheet(Workbook workbook, MappingEntry entry, Path path) {
        Sheet sheet = workbook.getSheet(entry.name());
        if (sheet == null) {
            throw new ValidationException("No sheet for " + entry.type().displayName() + " '" + entry.name()
                    + "' in " + path);
        }
        List<List<String>> rows = rows(sheet);
        List<String> header = rows.isEmpty() ? List.of() : rows.get(0);
        List<List<String>> data = rows.isEmpty() ? List.of() : rows.subList(1, rows.size());

        List<String> indexSets = entry.indexSets();
        List<String> indexNames = entry.indexNames();
        if (indexSets == null) {
            indexSets = headerDimensions(entry, header);
            indexNames = indexSets;
        }
        return new SheetData(entry.name(), entry.type(), indexSets, indexNames == null ? List.of() : indexNames,
                header, data);
    }

    private static List<String> headerDimensions(MappingEntry entry, List<String> header) {
        if (entry.type() == ItemType.SET) {
            if (header.size() == 1 && (header.get(0).equals(entry.name()) || header.get(0).equals("0"))) {
                return List.of();
            }
            return header;
        }
        List<String> dimensions = new ArrayList<>(header);
        dimensions.removeAll(List.of(VALUE, UNIT, "lvl", "mrg"));
        return dimensions;
    }

    private static List<List<String>> rows(Sheet sheet) {
        DataFormatter formatter = new DataFormatter();
        List<List<String>> rows = new ArrayList<>();
        for (Row row : sheet) {
            List<String> cells = new ArrayList<>();
            for (int c = 0; c < row.getLastCellNum(); c++) {
                Cell cell = row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
                cells.add(cell == null ? null : text(cell, formatter));
            }
            rows.add(cells);
        }
        return rows;
    }

    private static String text(Cell cell, DataFormatter formatter) {
        if (cell.getCellType() != CellType.NUMERIC) {
            return formatter.formatCellValue(cell);
        }
        // the display format rounds; keep every digit of stored numbers
        double value = cell.getNumericCellValue();
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static List<String> split(String joined) {
        if (joined == null || joined.isBlank()) {
            return List.of();
        }
        return List.of(joined.split(SEPARATOR));
    }

    private static String cell(List<String> row, int column) {
        return column < row.size() ? row.get(column) : null;
    }

    private static Double number(String item, String text) {
        if (text == null) {
            return null;
        }
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Sheet '" + item + "' holds a non-numeric value '" + text + "'", e);
        }
    }
}
