package com.dicalc.adapter.out.rates;

import com.dicalc.application.port.out.RateTableProvider;
import com.dicalc.domain.exception.RateNotFoundException;
import com.dicalc.domain.model.RateTableEntry;
import com.dicalc.domain.model.RateTerm;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * In-memory rate table built once from a snapshot.
 * Implements RateTableProvider output port; immutable after construction, so safe to share between calculations.
 */
@Slf4j
public class SnapshotRateTableAdapter implements RateTableProvider {

    private final Map<RateTerm, NavigableMap<LocalDate, BigDecimal>> rates;
    private final String version;
    private final LocalDate asOf;

    public SnapshotRateTableAdapter(String version, LocalDate asOf, Collection<RateTableEntry> entries) {
        Map<RateTerm, NavigableMap<LocalDate, BigDecimal>> byTerm = new EnumMap<>(RateTerm.class);
        for (RateTableEntry entry : entries) {
            NavigableMap<LocalDate, BigDecimal> series = byTerm.computeIfAbsent(entry.getTerm(), t -> new TreeMap<>());
            if (series.putIfAbsent(entry.getEffectiveDate(), entry.getAnnualRatePercent()) != null) {
                throw new IllegalArgumentException(String.format("Duplicate %s rate entry on %s",
                        entry.getTerm().getValue(), entry.getEffectiveDate()));
            }
        }
        for (RateTerm term : RateTerm.values()) {
            if (!byTerm.containsKey(term)) {
                throw new IllegalArgumentException("Rate table has no " + term.getValue() + " entries");
            }
            byTerm.put(term, Collections.unmodifiableNavigableMap(byTerm.get(term)));
        }
        this.rates = Collections.unmodifiableMap(byTerm);
        this.version = version;
        this.asOf = asOf;
        log.debug("Rate table {} ready: {} short-term and {} long-term entries",
                version, byTerm.get(RateTerm.SHORT_TERM).size(), byTerm.get(RateTerm.LONG_TERM).size());
    }

    public static SnapshotRateTableAdapter fromSnapshot(RateTableSnapshot snapshot) {
        List<RateTableEntry> entries = new ArrayList<>(snapshot.entries().size() * 2);
        for (RateTableSnapshot.Publication publication : snapshot.entries()) {
            LocalDate date = LocalDate.parse(publication.date());
            if (publication.shortTerm() != null) {
                entries.add(new RateTableEntry(RateTerm.SHORT_TERM, date, publication.shortTerm()));
            }
            if (publication.longTerm() != null) {
                entries.add(new RateTableEntry(RateTerm.LONG_TERM, date, publication.longTerm()));
            }
        }
        return new SnapshotRateTableAdapter(snapshot.version(), LocalDate.parse(snapshot.asOf()), entries);
    }

    @Override
    public BigDecimal lookup(RateTerm term, LocalDate date) {
        NavigableMap<LocalDate, BigDecimal> series = rates.get(term);
        Map.Entry<LocalDate, BigDecimal> inForce = series.floorEntry(date);
        if (inForce == null) {
            throw new RateNotFoundException(term, date, series.firstKey());
        }
        return inForce.getValue();
    }

    @Override
    public List<LocalDate> rateChangeDates(RateTerm term, LocalDate start, LocalDate end) {
        NavigableMap<LocalDate, BigDecimal> series = rates.get(term);
        List<LocalDate> changes = new ArrayList<>();
        for (Map.Entry<LocalDate, BigDecimal> entry : series.subMap(start, false, end, true).entrySet()) {
            Map.Entry<LocalDate, BigDecimal> previous = series.lowerEntry(entry.getKey());
            // republication at an unchanged rate is not a change
            if (previous == null || previous.getValue().compareTo(entry.getValue()) != 0) {
                changes.add(entry.getKey());
            }
        }
        return changes;
    }

    @Override
    public LocalDate lastEffectiveDate(RateTerm term) {
        return rates.get(term).lastKey();
    }

    @Override
    public String version() {
        return version;
    }

    @Override
    public LocalDate asOf() {
        return asOf;
    }
}
