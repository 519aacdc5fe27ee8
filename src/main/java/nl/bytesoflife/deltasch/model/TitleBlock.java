package nl.bytesoflife.deltasch.model;

import nl.bytesoflife.deltasch.sexpr.SNode.SAtom;
import nl.bytesoflife.deltasch.sexpr.SNode.SList;

import java.util.Map;
import java.util.TreeMap;

/**
 * {@code (title_block (title "..") (date "..") (rev "..") (company "..") (comment 1 ".."))}.
 * Reads from a missing block return empty strings, the first write creates it.
 */
public class TitleBlock {

    private final Schematic schematic;

    TitleBlock(Schematic schematic) {
        this.schematic = schematic;
    }

    public String getTitle() {
        return field("title");
    }

    public void setTitle(String title) {
        setField("title", title);
    }

    public String getDate() {
        return field("date");
    }

    public void setDate(String date) {
        setField("date", date);
    }

    public String getRevision() {
        return field("rev");
    }

    public void setRevision(String revision) {
        setField("rev", revision);
    }

    public String getCompany() {
        return field("company");
    }

    public void setCompany(String company) {
        setField("company", company);
    }

    public Map<Integer, String> getComments() {
        Map<Integer, String> comments = new TreeMap<>();
        SList block = block(false);
        if (block != null) {
            for (SList comment : block.findAll("comment")) {
                comments.put((int) comment.number(1, 0), comment.value(2));
            }
        }
        return comments;
    }

    public void setComment(int number, String text) {
        SList block = block(true);
        for (SList comment : block.findAll("comment")) {
            if ((int) comment.number(1, 0) == number) {
                SchematicElement.setAtom(comment, 2, SAtom.string(text));
                schematic.headerChanged();
                return;
            }
        }
        block.add(SList.of("comment", SAtom.integer(number), SAtom.string(text)));
        schematic.headerChanged();
    }

    private String field(String tag) {
        SList block = block(false);
        if (block == null) return "";
        SList field = block.find(tag);
        String value = field != null ? field.value(1) : null;
        return value != null ? value : "";
    }

    private void setField(String tag, String value) {
        SList block = block(true);
        SList field = block.find(tag);
        if (field == null) {
            block.add(SList.of(tag, SAtom.string(value)));
        } else {
            SchematicElement.setAtom(field, 1, SAtom.string(value));
        }
        schematic.headerChanged();
    }

    private SList block(boolean create) {
        SList root = schematic.getRoot();
        SList block = root.find("title_block");
        if (block == null && create) {
            block = SList.of("title_block");
            SList paper = root.find("paper");
            int index = paper != null ? root.indexOf(paper) + 1 : Math.min(root.size(), 4);
            root.insert(index, block);
        }
        return block;
    }
}
