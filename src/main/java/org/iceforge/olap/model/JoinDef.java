package org.iceforge.olap.model;

import java.util.ArrayList;
import java.util.List;

public class JoinDef {
    private String left;
    private String right;
    private String kind = "left"; // inner | left
    private List<Condition> on = new ArrayList<>();

    public String getLeft() {
        return left;
    }

    public void setLeft(String left) {
        this.left = left;
    }

    public String getRight() {
        return right;
    }

    public void setRight(String right) {
        this.right = right;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public List<Condition> getOn() {
        return on;
    }

    public void setOn(List<Condition> on) {
        this.on = on;
    }

    /**
     * Equality between a column of the left table and a column of the right table.
     */
    public static class Condition {
        private String left;
        private String right;

        public String getLeft() {
            return left;
        }

        public void setLeft(String left) {
            this.left = left;
        }

        public String getRight() {
            return right;
        }

        public void setRight(String right) {
            this.right = right;
        }
    }
}
