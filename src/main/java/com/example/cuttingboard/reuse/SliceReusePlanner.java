package com.example.cuttingboard.reuse;

import com.example.cuttingboard.CubeException;
import com.example.cuttingboard.query.CubeQuery;
import com.example.cuttingboard.slice.Slice;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Chooses the cheapest way of deriving a query's slice from cached slices.
 *
 * <p>Every enabled strategy is tried against every cached slice, strategies
 * in configuration order and slices most recent first. A plan of cost 1
 * ends the search at once; otherwise the plan with the lowest cost wins,
 * ties going to the most recently used slice.
 */
public class SliceReusePlanner {

    private final List<SliceReuseStrategy> strategies;

    public SliceReusePlanner(List<? extends SliceReuseStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * Creates a planner with the strategies of the given names, in that order.
     *
     * @throws CubeException if a name is not a known strategy
     */
    public static SliceReusePlanner withStrategies(List<String> names) {
        List<SliceReuseStrategy> rv = new ArrayList<>();
        for (String name : names) {
            rv.add(strategy(name));
        }
        return new SliceReusePlanner(rv);
    }

    public static SliceReuseStrategy strategy(String name) {
        return switch (name) {
            case ReuseCachedSlice.NAME -> new ReuseCachedSlice();
            case DrillOnFirstAxis.NAME -> new DrillOnFirstAxis();
            case ManipulateSlice.NAME -> new ManipulateSlice();
            default -> throw new CubeException("unknown reuse strategy: '" + name + "'");
        };
    }

    public List<SliceReuseStrategy> strategies() {
        return strategies;
    }

    public Optional<ReusePlan> plan(CubeQuery query, List<Slice> cached) {
        List<ReusePlan> plans = new ArrayList<>();
        for (SliceReuseStrategy strategy : strategies) {
            for (int i = 0; i < cached.size(); i++) {
                Slice slice = cached.get(i);
                if (!strategy.isCompatible(query, slice)) {
                    continue;
                }
                ReusePlan plan = new ReusePlan(strategy.estimateCost(query, slice), i, strategy, slice);
                if (plan.cost() <= 1) {
                    return Optional.of(plan);
                }
                plans.add(plan);
            }
        }
        return plans.stream()
                .min(Comparator.comparingInt(ReusePlan::cost).thenComparingInt(ReusePlan::index));
    }
}
