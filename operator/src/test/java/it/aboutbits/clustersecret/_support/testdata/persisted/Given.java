package it.aboutbits.clustersecret._support.testdata.persisted;

import it.aboutbits.clustersecret._support.InMemoryObjectStore;
import it.aboutbits.clustersecret._support.testdata.persisted.creator.ClusterSecretCreate;
import it.aboutbits.clustersecret._support.testdata.persisted.creator.NamespaceCreate;
import it.aboutbits.clustersecret._support.testdata.persisted.creator.SecretCreate;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import org.jspecify.annotations.NullMarked;

@NullMarked
@RequiredArgsConstructor
public class Given {
    private final InMemoryObjectStore objectStore;

    public One one() {
        return new One();
    }

    public Many many(int numberOfItems) {
        return new Many(numberOfItems);
    }

    public class One extends Item {
        One() {
            super(1);
        }
    }

    public class Many extends Item {
        Many(int numberOfItems) {
            super(numberOfItems);
        }
    }

    @RequiredArgsConstructor(access = AccessLevel.PACKAGE)
    public abstract class Item {
        private final int numberOfItems;

        @SuppressWarnings("unused")
        public Item describedAs(String description) {
            return this;
        }

        public NamespaceCreate namespace() {
            return new NamespaceCreate(
                    numberOfItems,
                    objectStore
            );
        }

        public SecretCreate secret() {
            return new SecretCreate(
                    numberOfItems,
                    objectStore
            );
        }

        public ClusterSecretCreate clusterSecret() {
            return new ClusterSecretCreate(
                    numberOfItems,
                    objectStore
            );
        }
    }
}
