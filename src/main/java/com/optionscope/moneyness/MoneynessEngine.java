package com.optionscope.moneyness;

import com.optionscope.aggregate.StreamAggregateTable;
import com.optionscope.model.Contract;
import com.optionscope.model.ContractType;
import com.optionscope.model.MoneynessRecord;
import com.optionscope.model.UnderlyingDailyPrice;
import com.optionscope.price.StockPriceRegistry;
import com.optionscope.universe.OptionUniverse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates each contract against the underlying's close on its expiry date.
 * <p>
 * A call is worth {@code close - strike}, a put {@code strike - close}; a call and a put struck
 * at the same level against the same close differ only in sign. Contracts with no close on the
 * expiry date, no strike, or a type other than Call/Put are left out of the table.
 */
public final class MoneynessEngine {
    private static final Logger LOG = LogManager.getLogger(MoneynessEngine.class);

    public MoneynessTable compute(OptionUniverse universe, StockPriceRegistry prices, StreamAggregateTable aggregates) {
        List<MoneynessRecord> records = new ArrayList<>();
        int missingPrice = 0;
        int missingStrike = 0;
        int unknownType = 0;
        for (Contract contract : universe.contracts()) {
            UnderlyingDailyPrice price = prices.lookup(contract.underlyingId, contract.expiryDate);
            if (price == null || price.close == null) {
                missingPrice++;
                continue;
            }
            ContractType type = contract.type();
            if (type == null) {
                unknownType++;
                continue;
            }
            if (contract.strikePrice == null) {
                missingStrike++;
                continue;
            }
            records.add(MoneynessRecord.builder()
                    .contractId(contract.id)
                    .contractType(type)
                    .strikePrice(contract.strikePrice)
                    .underlyingId(contract.underlyingId)
                    .expiryDate(contract.expiryDate)
                    .closeOnExpiry(price.close)
                    .volumeOnExpiry(price.volume)
                    .streamAggregate(aggregates.findOrEmpty(contract.id))
                    .moneyness(moneyness(type, price.close, contract.strikePrice))
                    .build());
        }
        LOG.info("Moneyness: universe={} records={} no_price_on_expiry={} unknown_type={} no_strike={}",
                universe.size(), records.size(), missingPrice, unknownType, missingStrike);
        return new MoneynessTable(records, missingPrice, missingStrike, unknownType);
    }

    public static double moneyness(ContractType type, double closeOnExpiry, double strikePrice) {
        switch (type) {
            case CALL:
                return closeOnExpiry - strikePrice;
            case PUT:
                return strikePrice - closeOnExpiry;
            default:
                throw new IllegalArgumentException("unsupported contract type: " + type);
        }
    }
}
