package io.github.eutro.charonj.passes.misc;

import io.github.eutro.charonj.decls.BodyOwner;
import io.github.eutro.charonj.decls.DeclTable;
import io.github.eutro.charonj.passes.IRPass;
import io.github.eutro.charonj.passes.InPlaceIRPass;
import io.github.eutro.charonj.ullbc.UllbcBody;

/**
 * Passes which lift passes over single bodies into passes over a whole crate.
 */
public class ForPass {
    /**
     * Lift an unstructured body pass to operate on every function and global of a crate that has a body.
     * <p>
     * Bodies are visited in id order, functions first.
     *
     * @param pass The body pass.
     * @return The crate pass.
     */
    public static UllbcBodies liftUllbcBodies(IRPass<UllbcBody, UllbcBody> pass) {
        return new UllbcBodies(pass);
    }

    /**
     * An unstructured body pass lifted to operate on a full crate.
     */
    public static class UllbcBodies implements InPlaceIRPass<DeclTable> {
        private final IRPass<UllbcBody, UllbcBody> pass;

        private UllbcBodies(IRPass<UllbcBody, UllbcBody> pass) {
            this.pass = pass;
        }

        @Override
        public void runInPlace(DeclTable table) {
            for (BodyOwner owner : table.getBodyOwners()) {
                UllbcBody body = owner.getBody();
                if (body == null) continue;
                try {
                    UllbcBody result = pass.run(body);
                    if (!pass.isInPlace()) owner.setBody(result);
                } catch (RuntimeException | Error t) {
                    t.addSuppressed(new RuntimeException("in " + owner.getDeclaration().id
                            + " (" + owner.getDeclaration().name + ")"));
                    throw t;
                }
            }
        }
    }
}
