package org.opmsim.petrinet.simulator;

import java.util.HashMap;
import java.util.Map;

import org.opmsim.petrinet.model.Arc;
import org.opmsim.petrinet.model.PetriNet;
import org.opmsim.petrinet.model.Place;

/**
 * Upper bound on the tokens a place may hold.
 */
public interface PlaceCapacity {

    PlaceCapacity UNBOUNDED = placeId -> Integer.MAX_VALUE;

    int capacityOf(String placeId);

    static PlaceCapacity uniform(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1, got " + capacity);
        }
        return placeId -> capacity;
    }

    /**
     * Condition/event reading of a derived net: a place holds at most one token, so an
     * object is either there or not. A place whose arcs or initial marking need more tokens
     * gets that many instead.
     */
    static PlaceCapacity conditions(PetriNet net) {
        Map<String, Integer> capacities = new HashMap<>();
        for (Place place : net.getPlaces()) {
            capacities.put(place.getId(), Math.max(1, net.getInitialMarking().get(place.getId())));
        }
        for (Arc arc : net.getArcs()) {
            capacities.merge(arc.getPlaceId(), arc.getWeight(), Math::max);
        }
        return of(capacities);
    }

    /** Listed places get their capacity, every other place is unbounded. */
    static PlaceCapacity of(Map<String, Integer> capacities) {
        Map<String, Integer> copy = new HashMap<>(capacities);
        return placeId -> {
            Integer capacity = copy.get(placeId);
            return capacity == null ? Integer.MAX_VALUE : capacity;
        };
    }
}
