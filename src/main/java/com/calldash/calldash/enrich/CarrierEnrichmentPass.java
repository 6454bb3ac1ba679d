package com.calldash.calldash.enrich;

import com.calldash.calldash.data.Row;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fills {@code CallerCarrier} from the caller's area code. Resolved carriers are never overwritten.
 */
@Component
public class CarrierEnrichmentPass implements EnrichmentPass {

    @Override
    public String type() {
        return EnrichmentConstants.TYPE_CARRIER;
    }

    @Override
    public List<String> ownedColumns() {
        return List.of(EnrichmentConstants.COLUMN_CALLER_CARRIER);
    }

    @Override
    public RowEnricher begin(List<Row> rows) {
        return row -> {
            if (RowValues.isResolved(RowValues.text(row, EnrichmentConstants.COLUMN_CALLER_CARRIER))) {
                return false;
            }
            String areaCode = areaCode(RowValues.text(row, EnrichmentConstants.COLUMN_CALLER_ID));
            String carrier = ReferenceTables.carrierForAreaCode(areaCode);
            if (carrier != null) {
                row.put(EnrichmentConstants.COLUMN_CALLER_CARRIER, carrier);
                return true;
            }
            if (areaCode.length() == 3) {
                row.put(EnrichmentConstants.COLUMN_CALLER_CARRIER, EnrichmentConstants.UNKNOWN_CARRIER);
            }
            return false;
        };
    }

    @Override
    public String message(int enrichedCount) {
        return "Enriched carrier for %d records".formatted(enrichedCount);
    }

    static String areaCode(String callerId) {
        if (callerId == null) {
            return "";
        }
        String digits = callerId.replaceAll("\\D", "");
        return digits.length() > 3 ? digits.substring(0, 3) : digits;
    }
}
