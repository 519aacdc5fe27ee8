package nl.bytesoflife.deltasch.hierarchy;

import nl.bytesoflife.deltasch.connectivity.Net;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A net that may span several sheet instances.
 */
public class HierarchicalNet {

    /**
     * The part of the net inside one sheet instance.
     */
    public record Member(String path, int depth, Net net) {}

    private final String name;
    private final List<Member> members;
    private final SortedSet<InstancePin> pins = new TreeSet<>();

    HierarchicalNet(String name, List<Member> members) {
        this.name = name;
        this.members = List.copyOf(members);
        for (Member member : members) {
            member.net().getPins().forEach(pin -> pins.add(new InstancePin(member.path(), pin)));
        }
    }

    public String getName() {
        return name;
    }

    public List<Member> getMembers() {
        return members;
    }

    public SortedSet<InstancePin> getPins() {
        return Collections.unmodifiableSortedSet(pins);
    }

    public Set<String> getPaths() {
        Set<String> paths = new LinkedHashSet<>();
        for (Member member : members) {
            paths.add(member.path());
        }
        return paths;
    }

    /**
     * Local net names per member, in member order.
     */
    public List<String> getLocalNames() {
        List<String> names = new ArrayList<>();
        for (Member member : members) {
            names.add(member.path() + ":" + member.net().getName());
        }
        return names;
    }

    public boolean spansSheets() {
        return getPaths().size() > 1;
    }

    @Override
    public String toString() {
        return name + " " + getPaths() + " " + pins;
    }
}
