package io.github.eutro.charonj.ullbc;

import io.github.eutro.charonj.expr.Place;
import io.github.eutro.charonj.expr.Rvalue;

import java.util.Objects;

/**
 * A statement of a {@link BasicBlock}. Statements never transfer control.
 */
public abstract class Statement {
    private Statement() {
    }

    public abstract <R> R accept(Visitor<R> v);

    public interface Visitor<R> {
        R visitAssign(Assign stmt);

        R visitFakeRead(FakeRead stmt);

        R visitSetDiscriminant(SetDiscriminant stmt);

        R visitStorageLive(StorageLive stmt);

        R visitStorageDead(StorageDead stmt);

        R visitDeinit(Deinit stmt);

        R visitDrop(Drop stmt);

        R visitNop(Nop stmt);
    }

    public static final Nop NOP = new Nop();

    public static final class Assign extends Statement {
        public final Place place;
        public final Rvalue rvalue;

        public Assign(Place place, Rvalue rvalue) {
            this.place = place;
            this.rvalue = rvalue;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitAssign(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Assign assign = (Assign) o;
            return place.equals(assign.place) && rvalue.equals(assign.rvalue);
        }

        @Override
        public int hashCode() {
            return Objects.hash(place, rvalue);
        }

        @Override
        public String toString() {
            return place + " := " + rvalue;
        }
    }

    public static final class FakeRead extends Statement {
        public final Place place;

        public FakeRead(Place place) {
            this.place = place;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitFakeRead(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof FakeRead && ((FakeRead) o).place.equals(place);
        }

        @Override
        public int hashCode() {
            return place.hashCode() * 3;
        }

        @Override
        public String toString() {
            return "@fake_read(" + place + ")";
        }
    }

    public static final class SetDiscriminant extends Statement {
        public final Place place;
        public final int variant;

        public SetDiscriminant(Place place, int variant) {
            this.place = place;
            this.variant = variant;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitSetDiscriminant(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            SetDiscriminant that = (SetDiscriminant) o;
            return variant == that.variant && place.equals(that.place);
        }

        @Override
        public int hashCode() {
            return Objects.hash(place, variant);
        }

        @Override
        public String toString() {
            return "@discriminant(" + place + ") := " + variant;
        }
    }

    public static final class StorageLive extends Statement {
        public final int local;

        public StorageLive(int local) {
            this.local = local;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitStorageLive(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof StorageLive && ((StorageLive) o).local == local;
        }

        @Override
        public int hashCode() {
            return local * 5;
        }

        @Override
        public String toString() {
            return "storage_live(_" + local + ")";
        }
    }

    public static final class StorageDead extends Statement {
        public final int local;

        public StorageDead(int local) {
            this.local = local;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitStorageDead(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof StorageDead && ((StorageDead) o).local == local;
        }

        @Override
        public int hashCode() {
            return local * 7;
        }

        @Override
        public String toString() {
            return "storage_dead(_" + local + ")";
        }
    }

    public static final class Deinit extends Statement {
        public final Place place;

        public Deinit(Place place) {
            this.place = place;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitDeinit(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Deinit && ((Deinit) o).place.equals(place);
        }

        @Override
        public int hashCode() {
            return place.hashCode() * 11;
        }

        @Override
        public String toString() {
            return "deinit(" + place + ")";
        }
    }

    public static final class Drop extends Statement {
        public final Place place;

        public Drop(Place place) {
            this.place = place;
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitDrop(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Drop && ((Drop) o).place.equals(place);
        }

        @Override
        public int hashCode() {
            return place.hashCode() * 13;
        }

        @Override
        public String toString() {
            return "drop " + place;
        }
    }

    public static final class Nop extends Statement {
        private Nop() {
        }

        @Override
        public <R> R accept(Visitor<R> v) {
            return v.visitNop(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Nop;
        }

        @Override
        public int hashCode() {
            return 17;
        }

        @Override
        public String toString() {
            return "nop";
        }
    }
}
