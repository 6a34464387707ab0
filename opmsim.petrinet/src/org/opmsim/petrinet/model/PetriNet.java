package org.opmsim.petrinet.model;

import java.util.*;

import org.opmsim.diagram.model.Identifiers;

/**
 * Immutable place/transition net with weighted input, output and test arcs and an initial
 * marking. Transitions are kept in process order, then identifier order, which is the order
 * used for deterministic tie-breaks.
 */
public final class PetriNet {
    private static final Comparator<String> PROCESS_ORDER = Comparator.nullsLast(Identifiers.ORDER);
    private static final Comparator<Transition> TRANSITION_ORDER =
            Comparator.comparing(Transition::getProcessId, PROCESS_ORDER)
                    .thenComparing(Transition::getId, Identifiers.ORDER);

    private final Map<String, Place> places;
    private final Map<String, Transition> transitions;
    private final List<Arc> arcs;
    private final Map<String, List<Arc>> arcsByTransition;
    private final Marking initialMarking;

    private PetriNet(Builder builder) {
        this.places = Collections.unmodifiableMap(new LinkedHashMap<>(builder.places));

        List<Transition> ordered = new ArrayList<>(builder.transitions.values());
        ordered.sort(TRANSITION_ORDER);
        Map<String, Transition> byId = new LinkedHashMap<>();
        for (Transition transition : ordered) {
            byId.put(transition.getId(), transition);
        }
        this.transitions = Collections.unmodifiableMap(byId);

        List<Arc> merged = new ArrayList<>();
        for (Map.Entry<List<Object>, Integer> entry : builder.arcWeights.entrySet()) {
            List<Object> key = entry.getKey();
            merged.add(new Arc((String) key.get(0), (String) key.get(1), (ArcType) key.get(2), entry.getValue()));
        }
        this.arcs = Collections.unmodifiableList(merged);

        Map<String, List<Arc>> index = new HashMap<>();
        for (Arc arc : merged) {
            index.computeIfAbsent(arc.getTransitionId(), k -> new ArrayList<>()).add(arc);
        }
        this.arcsByTransition = index;
        this.initialMarking = Marking.of(builder.initialTokens);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Collection<Place> getPlaces() {
        return places.values();
    }

    /** Transitions in tie-break order. */
    public List<Transition> getTransitions() {
        return new ArrayList<>(transitions.values());
    }

    public List<Arc> getArcs() {
        return arcs;
    }

    public Place getPlace(String placeId) {
        return places.get(placeId);
    }

    public Transition getTransition(String transitionId) {
        return transitions.get(transitionId);
    }

    public boolean hasPlace(String placeId) {
        return places.containsKey(placeId);
    }

    public List<Arc> arcsOf(String transitionId) {
        List<Arc> list = arcsByTransition.get(transitionId);
        return list == null ? Collections.<Arc>emptyList() : Collections.unmodifiableList(list);
    }

    public List<Arc> arcsOf(String transitionId, ArcType type) {
        List<Arc> matching = new ArrayList<>();
        for (Arc arc : arcsOf(transitionId)) {
            if (arc.getType() == type) {
                matching.add(arc);
            }
        }
        return matching;
    }

    public Marking getInitialMarking() {
        return initialMarking;
    }

    @Override
    public String toString() {
        return "PetriNet[" + places.size() + " places, " + transitions.size() + " transitions, "
                + arcs.size() + " arcs]";
    }

    /**
     * Collects the net element by element. Arcs with the same place, transition and type
     * are merged by adding their weights.
     */
    public static final class Builder {
        private final Map<String, Place> places = new LinkedHashMap<>();
        private final Map<String, Transition> transitions = new LinkedHashMap<>();
        private final Map<List<Object>, Integer> arcWeights = new LinkedHashMap<>();
        private final Map<String, Integer> initialTokens = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder addPlace(Place place) {
            if (places.containsKey(place.getId())) {
                throw new IllegalArgumentException("Duplicate place " + place.getId());
            }
            places.put(place.getId(), place);
            return this;
        }

        public Builder addTransition(Transition transition) {
            if (transitions.containsKey(transition.getId())) {
                throw new IllegalArgumentException("Duplicate transition " + transition.getId());
            }
            transitions.put(transition.getId(), transition);
            return this;
        }

        public Builder addArc(String placeId, String transitionId, ArcType type, int weight) {
            if (!places.containsKey(placeId)) {
                throw new IllegalArgumentException("Arc refers to unknown place " + placeId);
            }
            if (!transitions.containsKey(transitionId)) {
                throw new IllegalArgumentException("Arc refers to unknown transition " + transitionId);
            }
            if (weight < 1) {
                throw new IllegalArgumentException("Arc weight must be at least 1, got " + weight);
            }
            arcWeights.merge(Arrays.<Object>asList(placeId, transitionId, type), weight, Integer::sum);
            return this;
        }

        public Builder setInitialTokens(String placeId, int count) {
            if (!places.containsKey(placeId)) {
                throw new IllegalArgumentException("Unknown place " + placeId);
            }
            initialTokens.put(placeId, count);
            return this;
        }

        public PetriNet build() {
            return new PetriNet(this);
        }
    }
}
