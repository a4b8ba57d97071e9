package org.modelplatform.api.backend;

import java.util.List;
import java.util.Map;

import org.modelplatform.api.item.ItemDefinition;
import org.modelplatform.api.item.ItemRow;

/**
 * Engine-neutral copy of one stored run, used to clone between backend instances.
 *
 * @param scheme      scheme of the source run
 * @param items       item definitions in creation order
 * @param elements    rows per item name
 * @param timeseries  time-series values with metadata flags
 * @param geodata     geodata rows
 * @param hasSolution whether the snapshot carries solution values
 * @param meta        meta entries attached to the source run itself
 */
public record ScenarioSnapshot(
        String scheme,
        List<ItemDefinition> items,
        Map<String, List<ItemRow>> elements,
        List<TimeSeriesEntry> timeseries,
        List<GeoRow> geodata,
        boolean hasSolution,
        Map<String, Object> meta) {

    public ScenarioSnapshot {
        items = List.copyOf(items);
        elements = Map.copyOf(elements);
        timeseries = List.copyOf(timeseries);
        geodata = List.copyOf(geodata);
        meta = Map.copyOf(meta);
    }
}
