package org.modelplatform.core;

import java.io.IOException;
import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Function;

import org.modelplatform.api.backend.IBackend;
import org.modelplatform.api.backend.SessionRef;
import org.modelplatform.api.exceptions.ItemNotFoundException;
import org.modelplatform.api.exceptions.PreconditionException;
import org.modelplatform.api.exceptions.SolutionPresentException;
import org.modelplatform.api.exceptions.ValidationException;
import org.modelplatform.api.item.Element;
import org.modelplatform.api.item.IndexAttribute;
import org.modelplatform.api.item.ItemData;
import org.modelplatform.api.item.ItemRow;
import org.modelplatform.api.item.ItemType;
import org.modelplatform.api.item.ScalarData;
import org.modelplatform.core.input.ElementInput;
import org.modelplatform.core.input.ElementInputParser;
import org.modelplatform.core.input.FieldInput;
import org.modelplatform.io.ScenarioWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link TimeSeries} that also holds model items: sets, parameters, variables and equations.
 * <p>
 * Items are declared with the {@code init*} methods and filled with {@link #addSet} and
 * {@link #addPar}, both of which require a check-out. Variables and equations hold solution
 * values and can only be written by a solver through {@link #storeSolution}.
 * <pre>
 * Scenario s = Scenario.createNew(platform, "transport", "standard", "initial data");
 * s.initSet("i");
 * s.addSet("i", ElementInput.keys("seattle", "san-diego"));
 * s.initPar("a", List.of("i"));
 * s.addPar("a", ElementInput.keys("seattle", "san-diego"), FieldInput.each(List.of(350, 600)),
 *         FieldInput.of("cases"), FieldInput.none());
 * s.commit("initial data");
 * </pre>
 */
public class Scenario extends TimeSeries {

    private static final Logger log = LoggerFactory.getLogger(Scenario.class);

    protected Scenario(Platform platform, SessionRef session) {
        super(platform, session);
    }

    // ==================== Factories ====================

    public static Scenario load(Platform platform, String model, String scenario) {
        return load(platform, model, scenario, null);
    }

    /**
     * @param version stored version, or null for the default version
     * @throws ItemNotFoundException if there is no such run
     */
    public static Scenario load(Platform platform, String model, String scenario, Integer version) {
        Scenario s = new Scenario(platform, new SessionRef(model, scenario, version));
        s.bindExisting();
        return s;
    }

    public static Scenario createNew(Platform platform, String model, String scenario, String annotation) {
        return createNew(platform, model, scenario, annotation, null);
    }

    /**
     * @param scheme name of the data layout the scenario follows, or null
     */
    public static Scenario createNew(Platform platform, String model, String scenario, String annotation,
                                     String scheme) {
        SessionRef session = new SessionRef(model, scenario, null);
        session.setScheme(scheme);
        Scenario s = new Scenario(platform, session);
        s.bindNew(annotation);
        return s;
    }

    public static Scenario fromUrl(String url, Function<String, Platform> platforms) {
        ScenarioUrl parsed = ScenarioUrl.parse(url);
        Platform target = resolvePlatform(parsed, platforms);
        return parsed.isNew()
                ? createNew(target, parsed.model(), parsed.scenario(), null)
                : load(target, parsed.model(), parsed.scenario(), parsed.version());
    }

    @Override
    protected String kind() {
        return "Scenario";
    }

    // ==================== Lifecycle ====================

    /**
     * @throws SolutionPresentException if the scenario has a solution and {@code timeseriesOnly}
     *                                  is false
     */
    @Override
    public void checkOut(boolean timeseriesOnly) {
        if (!timeseriesOnly && hasSolution()) {
            throw new SolutionPresentException("This Scenario has a solution, use removeSolution() or "
                    + "clone(..., keepSolution=false)");
        }
        super.checkOut(timeseriesOnly);
    }

    // ==================== Item discovery ====================

    /**
     * @return names of the items of one kind, in creation order
     */
    public List<String> listItems(ItemType type) {
        return backend().listItems(session(), type);
    }

    /**
     * @see #items(ItemType, Map, String)
     */
    public Iterable<String> items(ItemType type) {
        return items(type, null, null);
    }

    /**
     * Iterates item names of one kind in name order. Each iteration queries the backend anew.
     *
     * @param filters   if non-empty, only items with at least one of these index names
     * @param indexedBy if non-null, only items indexed by this set
     */
    public Iterable<String> items(ItemType type, Map<String, ? extends Collection<?>> filters, String indexedBy) {
        return () -> {
            List<String> names = new ArrayList<>(listItems(type));
            Collections.sort(names);
            List<String> selected = new ArrayList<>(names.size());
            for (String name : names) {
                if (indexedBy != null && !idxSets(name).contains(indexedBy)) {
                    continue;
                }
                if (filters != null && !filters.isEmpty()
                        && Collections.disjoint(filters.keySet(), idxNames(name))) {
                    continue;
                }
                selected.add(name);
            }
            return selected.iterator();
        };
    }

    /**
     * Iterates (name, data) pairs of one kind, with {@code filters} reduced to each item's
     * dimensions. Items sharing no dimension with non-empty filters are skipped.
     */
    public Iterable<Map.Entry<String, ItemData>> iterItemData(ItemType type,
                                                             Map<String, ? extends Collection<?>> filters,
                                                             String indexedBy) {
        Iterable<String> names = items(type, filters, indexedBy);
        return () -> new Iterator<>() {
            private final Iterator<String> delegate = names.iterator();

            @Override
            public boolean hasNext() {
                return delegate.hasNext();
            }

            @Override
            public Map.Entry<String, ItemData> next() {
                if (!delegate.hasNext()) {
                    throw new NoSuchElementException();
                }
                String name = delegate.next();
                return new AbstractMap.SimpleImmutableEntry<>(name, itemData(type, name,
                        reduceFilters(filters, idxNames(name))));
            }
        };
    }

    public boolean hasItem(String name) {
        for (ItemType type : List.of(ItemType.SET, ItemType.PAR, ItemType.VAR, ItemType.EQU)) {
            if (listItems(type).contains(name)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasItem(ItemType type, String name) {
        return listItems(type).contains(name);
    }

    public boolean hasSet(String name) {
        return hasItem(ItemType.SET, name);
    }

    public boolean hasPar(String name) {
        return hasItem(ItemType.PAR, name);
    }

    public boolean hasVar(String name) {
        return hasItem(ItemType.VAR, name);
    }

    public boolean hasEqu(String name) {
        return hasItem(ItemType.EQU, name);
    }

    /**
     * @throws ItemNotFoundException if there is no item {@code name} of any kind
     */
    public List<String> idxSets(String name) {
        return backend().itemIndex(session(), name, IndexAttribute.SETS);
    }

    public List<String> idxNames(String name) {
        return backend().itemIndex(session(), name, IndexAttribute.NAMES);
    }

    // ==================== Item declaration ====================

    /**
     * Declares an item.
     *
     * @param indexSets  sets indexing the item, empty for a plain set or a scalar
     * @param indexNames dimension names, null to use the index set names
     * @throws ValidationException   if the name is taken or the index names do not fit
     * @throws ItemNotFoundException if an index set does not exist
     */
    public void initItem(ItemType type, String name, List<String> indexSets, List<String> indexNames) {
        backend().initItem(session(), type, name, indexSets == null ? List.of() : indexSets, indexNames);
    }

    public void initSet(String name) {
        initItem(ItemType.SET, name, List.of(), null);
    }

    public void initSet(String name, List<String> indexSets) {
        initItem(ItemType.SET, name, indexSets, null);
    }

    public void initSet(String name, List<String> indexSets, List<String> indexNames) {
        initItem(ItemType.SET, name, indexSets, indexNames);
    }

    public void initPar(String name, List<String> indexSets) {
        initItem(ItemType.PAR, name, indexSets, null);
    }

    public void initPar(String name, List<String> indexSets, List<String> indexNames) {
        initItem(ItemType.PAR, name, indexSets, indexNames);
    }

    public void initVar(String name, List<String> indexSets) {
        initItem(ItemType.VAR, name, indexSets, null);
    }

    public void initVar(String name, List<String> indexSets, List<String> indexNames) {
        initItem(ItemType.VAR, name, indexSets, indexNames);
    }

    public void initEqu(String name, List<String> indexSets) {
        initItem(ItemType.EQU, name, indexSets, null);
    }

    public void initEqu(String name, List<String> indexSets, List<String> indexNames) {
        initItem(ItemType.EQU, name, indexSets, indexNames);
    }

    /**
     * Declares a 0-dimensional parameter and sets its value.
     */
    public void initScalar(String name, double value, String unit, String comment) {
        initPar(name, List.of());
        changeScalar(name, value, unit, comment);
    }

    /**
     * Deletes an item with all its elements.
     *
     * @throws ValidationException if the item is a set indexing other items
     */
    public void deleteItem(ItemType type, String name) {
        backend().deleteItem(session(), type, name);
    }

    // ==================== Reading ====================

    public ItemData set(String name) {
        return set(name, null);
    }

    /**
     * @return keys of a plain index set, or a table of keys for an indexed set
     */
    public ItemData set(String name, Map<String, ? extends Collection<?>> filters) {
        return itemData(ItemType.SET, name, filters);
    }

    public ItemData par(String name) {
        return par(name, null);
    }

    /**
     * @param filters index name to allowed values; values are compared by string form
     * @return a table of (key, value, unit) rows, or a {@link ScalarData} for a 0-dimensional parameter
     */
    public ItemData par(String name, Map<String, ? extends Collection<?>> filters) {
        return itemData(ItemType.PAR, name, filters);
    }

    public ItemData var(String name) {
        return var(name, null);
    }

    public ItemData var(String name, Map<String, ? extends Collection<?>> filters) {
        return itemData(ItemType.VAR, name, filters);
    }

    public ItemData equ(String name) {
        return equ(name, null);
    }

    public ItemData equ(String name, Map<String, ? extends Collection<?>> filters) {
        return itemData(ItemType.EQU, name, filters);
    }

    /**
     * @return value and unit of a 0-dimensional parameter
     * @throws ValidationException if the parameter has dimensions
     */
    public ScalarData scalar(String name) {
        ItemData data = par(name);
        if (!(data instanceof ScalarData scalar)) {
            throw new ValidationException("Parameter '" + name + "' is indexed by " + idxSets(name)
                    + " and is not a scalar");
        }
        return scalar;
    }

    private ItemData itemData(ItemType type, String name, Map<String, ? extends Collection<?>> filters) {
        return backend().itemGetElements(session(), type, name, filters);
    }

    // ==================== Writing ====================

    public void addSet(String name, ElementInput key) {
        addSet(name, key, FieldInput.none());
    }

    /**
     * Adds elements to a set. All elements are validated before any is written.
     *
     * @throws ItemNotFoundException if the set does not exist
     * @throws ValidationException   for keys that do not fit the set's dimensions or comments that do
     *                               not pair with the keys
     */
    public void addSet(String name, ElementInput key, FieldInput<String> comment) {
        List<Element> elements = ElementInputParser.parseSet(name, idxNames(name), key, comment);
        if (elements.isEmpty()) {
            return;
        }
        backend().itemSetElements(session(), ItemType.SET, name, elements);
    }

    /**
     * Adds elements with a single value and unit applied to every key.
     */
    public void addPar(String name, ElementInput keys, double value, String unit) {
        addPar(name, keys, FieldInput.of(value), FieldInput.of(unit), FieldInput.none());
    }

    /**
     * Adds elements from a table or columns carrying their own value, unit and comment columns.
     */
    public void addPar(String name, ElementInput data) {
        addPar(name, data, FieldInput.none(), FieldInput.none(), FieldInput.none());
    }

    /**
     * Adds or updates parameter elements. All elements are validated before any is written.
     *
     * @param unit units; elements without unit are stored with the unknown unit {@code ???}
     * @throws ItemNotFoundException if the parameter does not exist
     * @throws ValidationException   for keys not fitting the dimensions, missing values or fields
     *                               that do not pair with the keys
     */
    public void addPar(String name, ElementInput keyOrData, FieldInput<? extends Number> value,
                       FieldInput<String> unit, FieldInput<String> comment) {
        List<Element> elements = ElementInputParser.parseParameter(name, idxNames(name), keyOrData, value, unit,
                comment);
        if (elements.isEmpty()) {
            return;
        }
        backend().itemSetElements(session(), ItemType.PAR, name, elements);
    }

    /**
     * Sets the value of a 0-dimensional parameter.
     */
    public void changeScalar(String name, double value, String unit, String comment) {
        addPar(name, ElementInput.none(), FieldInput.of(value), FieldInput.of(unit), FieldInput.of(comment));
    }

    /**
     * Deletes a whole set.
     */
    public void removeSet(String name) {
        deleteItem(ItemType.SET, name);
    }

    /**
     * Deletes set elements. Elements of other items referring to them are deleted as well.
     */
    public void removeSet(String name, ElementInput key) {
        removeElements(ItemType.SET, name, key);
    }

    public void removePar(String name) {
        deleteItem(ItemType.PAR, name);
    }

    public void removePar(String name, ElementInput key) {
        removeElements(ItemType.PAR, name, key);
    }

    private void removeElements(ItemType type, String name, ElementInput key) {
        boolean indexSet = type == ItemType.SET && idxSets(name).isEmpty();
        List<List<String>> keys = ElementInputParser.parseKeys(name, idxNames(name), indexSet, key);
        if (keys.isEmpty()) {
            return;
        }
        backend().itemDeleteElements(session(), type, name, keys);
    }

    // ==================== Solution ====================

    public boolean hasSolution() {
        return backend().hasSolution(session());
    }

    /**
     * @see #removeSolution(Integer)
     */
    public void removeSolution() {
        removeSolution(null);
    }

    /**
     * Removes all variable and equation values.
     *
     * @param firstModelYear if given, also removes time-series rows from this year on, except
     *                       metadata rows
     * @throws PreconditionException if there is no solution
     */
    public void removeSolution(Integer firstModelYear) {
        if (!hasSolution()) {
            throw new PreconditionException("This Scenario does not have a solution!");
        }
        backend().clearSolution(session(), firstModelYear);
    }

    /**
     * Stores solver output for a variable or equation. Requires a check-out.
     *
     * @param rows key, level and marginal per element
     * @throws ItemNotFoundException if {@code name} is neither a variable nor an equation
     */
    public void storeSolution(String name, List<ItemRow> rows) {
        ItemType type;
        if (hasVar(name)) {
            type = ItemType.VAR;
        } else if (hasEqu(name)) {
            type = ItemType.EQU;
        } else {
            throw new ItemNotFoundException("No variable or equation named '" + name + "' in " + this);
        }
        backend().itemSetSolution(session(), type, name, rows);
    }

    // ==================== Clone ====================

    /**
     * Clones onto the same platform under the same names.
     */
    public Scenario clone(String annotation, boolean keepSolution) {
        return clone(null, null, null, annotation, keepSolution, null);
    }

    public Scenario clone(String model, String scenario, String annotation, boolean keepSolution) {
        return clone(null, model, scenario, annotation, keepSolution, null);
    }

    /**
     * Copies this scenario into a new, committed run.
     *
     * @param destination         target platform, null for this one
     * @param model               target model name, null for this model
     * @param scenario            target scenario name, null for this scenario
     * @param keepSolution        keep variable and equation values and all time series; without it
     *                            only metadata time series are copied
     * @param shiftFirstModelYear if given, implies {@code keepSolution=false}; non-metadata time
     *                            series are then copied only for years before it
     * @return a handle on the copy
     * @throws org.modelplatform.api.exceptions.UnsupportedBackendOperationException if the
     *         destination backend cannot receive the copy
     */
    public Scenario clone(Platform destination, String model, String scenario, String annotation,
                          boolean keepSolution, Integer shiftFirstModelYear) {
        boolean keep = keepSolution;
        if (shiftFirstModelYear != null && keepSolution) {
            log.warn("Overriding keepSolution=true for shiftFirstModelYear={}", shiftFirstModelYear);
            keep = false;
        }
        Platform target = destination == null ? platform() : destination;
        String targetModel = model == null ? model() : model;
        String targetScenario = scenario == null ? scenario() : scenario;
        IBackend targetBackend = target.getBackend();

        SessionRef copy = backend().cloneSession(session(), targetBackend, targetModel, targetScenario,
                annotation == null ? "" : annotation, keep, shiftFirstModelYear);
        Scenario clone = new Scenario(target, copy);
        clone.markLoaded();
        log.debug("Cloned {} to {}", this, clone);
        return clone;
    }

    // ==================== File exchange ====================

    /**
     * Writes all items to an xlsx workbook, one sheet per item.
     *
     * @see ScenarioWorkbook#write(Scenario, Path)
     */
    public void toExcel(Path path) throws IOException {
        ScenarioWorkbook.write(this, path);
    }

    /**
     * Adds the sets and parameters of a workbook written by {@link #toExcel(Path)}. Requires a
     * check-out.
     *
     * @param addUnits    define units the platform does not know yet
     * @param initItems   declare missing sets and parameters
     * @param commitSteps commit after the sets and after every parameter
     */
    public void readExcel(Path path, boolean addUnits, boolean initItems, boolean commitSteps) throws IOException {
        ScenarioWorkbook.read(this, path, new ScenarioWorkbook.ReadOptions(addUnits, initItems, commitSteps));
    }

    public void readExcel(Path path) throws IOException {
        ScenarioWorkbook.read(this, path, ScenarioWorkbook.ReadOptions.defaults());
    }

    // ==================== Helpers ====================

    private static Map<String, Collection<?>> reduceFilters(Map<String, ? extends Collection<?>> filters,
                                                            List<String> indexNames) {
        Map<String, Collection<?>> reduced = new LinkedHashMap<>();
        if (filters == null) {
            return reduced;
        }
        for (Map.Entry<String, ? extends Collection<?>> entry : filters.entrySet()) {
            if (indexNames.contains(entry.getKey())) {
                reduced.put(entry.getKey(), entry.getValue());
            }
        }
        return reduced;
    }
}
