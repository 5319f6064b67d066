package com.tributary.connect.converter;

import com.google.protobuf.ByteString;
import com.tributary.arrow.ArrowBatchDecoder;
import com.tributary.arrow.ArrowBatchEncoder;
import com.tributary.arrow.EncodedBatchIterator;
import com.tributary.connect.proto.Limit;
import com.tributary.connect.proto.LocalRelation;
import com.tributary.connect.proto.Range;
import com.tributary.connect.proto.Read;
import com.tributary.connect.proto.Relation;
import com.tributary.connect.proto.SQL;
import com.tributary.connect.proto.Union;
import com.tributary.connect.session.Session;
import com.tributary.connect.session.SessionKey;
import com.tributary.exception.AnalysisException;
import com.tributary.exception.EmbeddedRuntimeException;
import com.tributary.logical.LogicalPlan;
import com.tributary.logical.RangeRelation;
import com.tributary.logical.SQLRelation;
import com.tributary.logical.TableScan;
import com.tributary.test.TestBase;
import com.tributary.test.TestCategories;
import com.tributary.types.AtomicType;
import com.tributary.types.StructField;
import com.tributary.types.StructType;
import org.apache.arrow.memory.RootAllocator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for RelationConverter against a real session database.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("RelationConverter Tests")
class RelationConverterTest extends TestBase {

    private RootAllocator allocator;
    private Session session;
    private RelationConverter converter;

    @Override
    protected void doSetUp() {
        allocator = new RootAllocator();
        session = Session.create(new SessionKey("alice", "converter"));
        converter = new RelationConverter(session, new ArrowBatchDecoder(allocator));
    }

    @Override
    protected void doTearDown() {
        session.retire();
        allocator.close();
    }

    private static Relation range(long end) {
        return Relation.newBuilder()
            .setRange(Range.newBuilder().setEnd(end).setStep(1))
            .build();
    }

    private static Relation sql(String query) {
        return Relation.newBuilder().setSql(SQL.newBuilder().setQuery(query)).build();
    }

    private static Relation namedTable(String name) {
        return Relation.newBuilder()
            .setRead(Read.newBuilder().setNamedTable(Read.NamedTable.newBuilder().setUnparsedIdentifier(name)))
            .build();
    }

    @Nested
    @DisplayName("Range")
    class RangeTests {

        @Test
        @DisplayName("start defaults to zero")
        void startDefaultsToZero() {
            LogicalPlan plan = converter.convert(range(10));

            assertThat(plan).isEqualTo(new RangeRelation(0, 10, 1, OptionalInt.empty()));
        }

        @Test
        @DisplayName("num_partitions is carried through")
        void numPartitions() {
            Relation relation = Relation.newBuilder()
                .setRange(Range.newBuilder().setStart(5).setEnd(20).setStep(3).setNumPartitions(4))
                .build();

            assertThat(converter.convert(relation)).isEqualTo(new RangeRelation(5, 20, 3, OptionalInt.of(4)));
        }

        @Test
        @DisplayName("A zero step is rejected")
        void zeroStepRejected() {
            Relation relation = Relation.newBuilder().setRange(Range.newBuilder().setEnd(10)).build();

            assertThatThrownBy(() -> converter.convert(relation))
                .isInstanceOf(PlanConversionException.class)
                .hasMessage("Range step cannot be zero");
        }

        @Test
        @DisplayName("Non-positive num_partitions is rejected")
        void nonPositivePartitionsRejected() {
            Relation relation = Relation.newBuilder()
                .setRange(Range.newBuilder().setEnd(10).setStep(1).setNumPartitions(0))
                .build();

            assertThatThrownBy(() -> converter.convert(relation))
                .isInstanceOf(PlanConversionException.class)
                .hasMessageContaining("num_partitions");
        }
    }

    @Nested
    @DisplayName("SQL")
    class SqlTests {

        @Test
        @DisplayName("The schema is inferred by the session database")
        void schemaInferred() {
            LogicalPlan plan = converter.convert(sql("SELECT 1::BIGINT AS id, 'x' AS name"));

            assertThat(plan).isInstanceOf(SQLRelation.class);
            assertThat(plan.schema().fields())
                .extracting(StructField::name, StructField::dataType)
                .containsExactly(
                    tuple("id", AtomicType.LONG),
                    tuple("name", AtomicType.STRING));
        }

        @Test
        @DisplayName("A blank query is rejected")
        void blankQueryRejected() {
            assertThatThrownBy(() -> converter.convert(sql("   ")))
                .isInstanceOf(PlanConversionException.class);
        }

        @Test
        @DisplayName("A query the engine cannot bind is an embedded runtime failure")
        void invalidQueryIsEngineFailure() {
            assertThatThrownBy(() -> converter.convert(sql("SELECT * FROM no_such_table")))
                .isInstanceOf(EmbeddedRuntimeException.class);
        }
    }

    @Nested
    @DisplayName("Read")
    class ReadTests {

        @Test
        @DisplayName("Temporary views shadow session tables")
        void viewsShadowTables() {
            session.runtime().execute("CREATE TABLE people AS SELECT 1 AS id");
            RangeRelation view = new RangeRelation(0, 3, 1, OptionalInt.empty());
            session.registerTempView("people", view, false);

            assertThat(converter.convert(namedTable("people"))).isSameAs(view);
        }

        @Test
        @DisplayName("Session tables resolve to a table scan")
        void tableResolves() {
            session.runtime().execute("CREATE TABLE orders (id BIGINT, amount DOUBLE)");

            LogicalPlan plan = converter.convert(namedTable("orders"));

            assertThat(plan).isInstanceOf(TableScan.class);
            TableScan scan = (TableScan) plan;
            assertThat(scan.format()).isEqualTo(TableScan.TableFormat.TABLE);
            assertThat(scan.schema().size()).isEqualTo(2);
        }

        @Test
        @DisplayName("Unknown names are an analysis error")
        void unknownName() {
            assertThatThrownBy(() -> converter.convert(namedTable("ghost")))
                .isInstanceOf(AnalysisException.class)
                .hasMessage("Table or view not found: ghost");
        }

        @Test
        @DisplayName("CSV files are scanned and reported as input files")
        void csvDataSource(@TempDir Path dir) throws IOException {
            Path csv = dir.resolve("people.csv");
            Files.writeString(csv, "id,name\n1,ada\n2,grace\n");
            Relation relation = Relation.newBuilder()
                .setRead(Read.newBuilder().setDataSource(
                    Read.DataSource.newBuilder().setFormat("CSV").addPaths(csv.toString())))
                .build();

            LogicalPlan plan = converter.convert(relation);

            assertThat(plan).isInstanceOf(TableScan.class);
            assertThat(((TableScan) plan).format()).isEqualTo(TableScan.TableFormat.CSV);
            assertThat(plan.inputFiles()).containsExactly(csv.toString());
            assertThat(plan.schema().fields()).extracting(StructField::name).containsExactly("id", "name");
        }

        @Test
        @DisplayName("Unsupported formats and missing paths are rejected")
        void badDataSources() {
            Relation orc = Relation.newBuilder()
                .setRead(Read.newBuilder().setDataSource(
                    Read.DataSource.newBuilder().setFormat("orc").addPaths("/tmp/x.orc")))
                .build();
            Relation noPaths = Relation.newBuilder()
                .setRead(Read.newBuilder().setDataSource(Read.DataSource.newBuilder().setFormat("parquet")))
                .build();

            assertThatThrownBy(() -> converter.convert(orc))
                .isInstanceOf(PlanConversionException.class)
                .hasMessageContaining("Unsupported data source format");
            assertThatThrownBy(() -> converter.convert(noPaths))
                .isInstanceOf(PlanConversionException.class)
                .hasMessage("No path specified for parquet read");
        }

        @Test
        @DisplayName("A read without a source is rejected")
        void emptyRead() {
            Relation relation = Relation.newBuilder().setRead(Read.getDefaultInstance()).build();

            assertThatThrownBy(() -> converter.convert(relation))
                .isInstanceOf(PlanConversionException.class);
        }
    }

    @Nested
    @DisplayName("Composite relations")
    class CompositeTests {

        @Test
        @DisplayName("Limit wraps its converted input")
        void limit() {
            Relation relation = Relation.newBuilder()
                .setLimit(Limit.newBuilder().setInput(range(100)).setLimit(7))
                .build();

            LogicalPlan plan = converter.convert(relation);

            assertThat(plan).isInstanceOf(com.tributary.logical.Limit.class);
            assertThat(((com.tributary.logical.Limit) plan).limit()).isEqualTo(7);
            assertThat(plan.children()).containsExactly(new RangeRelation(0, 100, 1, OptionalInt.empty()));
        }

        @Test
        @DisplayName("Limit without input or with a negative count is rejected")
        void badLimit() {
            Relation noInput = Relation.newBuilder().setLimit(Limit.newBuilder().setLimit(1)).build();
            Relation negative = Relation.newBuilder()
                .setLimit(Limit.newBuilder().setInput(range(3)).setLimit(-1))
                .build();

            assertThatThrownBy(() -> converter.convert(noInput)).isInstanceOf(PlanConversionException.class);
            assertThatThrownBy(() -> converter.convert(negative)).isInstanceOf(PlanConversionException.class);
        }

        @Test
        @DisplayName("Union converts every input")
        void union() {
            Relation relation = Relation.newBuilder()
                .setUnion(Union.newBuilder().addInputs(range(3)).addInputs(range(5)))
                .build();

            LogicalPlan plan = converter.convert(relation);

            assertThat(plan).isInstanceOf(com.tributary.logical.Union.class);
            assertThat(plan.children()).hasSize(2);
        }

        @Test
        @DisplayName("Union of mismatched inputs is an analysis error")
        void mismatchedUnion() {
            Relation relation = Relation.newBuilder()
                .setUnion(Union.newBuilder().addInputs(range(3)).addInputs(sql("SELECT 1 AS a, 2 AS b")))
                .build();

            assertThatThrownBy(() -> converter.convert(relation)).isInstanceOf(AnalysisException.class);
            assertThatThrownBy(() -> converter.convert(
                Relation.newBuilder().setUnion(Union.getDefaultInstance()).build()))
                .isInstanceOf(PlanConversionException.class);
        }
    }

    @Nested
    @DisplayName("Local data")
    class LocalRelationTests {

        @Test
        @DisplayName("Arrow data is decoded into rows")
        void decodesArrowData() {
            StructType schema = new StructType(
                new StructField("id", AtomicType.LONG, false),
                new StructField("name", AtomicType.STRING, true));
            List<Object[]> rows = List.of(new Object[] {1L, "ada"}, new Object[] {2L, null});
            byte[] data;
            try (EncodedBatchIterator batches = new ArrowBatchEncoder(allocator)
                    .encode(rows.iterator(), schema, 0, Long.MAX_VALUE, "UTC")) {
                data = batches.next().data();
            }
            Relation relation = Relation.newBuilder()
                .setLocalRelation(LocalRelation.newBuilder().setData(ByteString.copyFrom(data)))
                .build();

            LogicalPlan plan = converter.convert(relation);

            assertThat(plan.isLocal()).isTrue();
            assertThat(plan.schema()).isEqualTo(schema);
            List<Object[]> decoded = ((com.tributary.logical.LocalRelation) plan).rows();
            assertThat(decoded).hasSize(2);
            assertThat(decoded.get(0)).containsExactly(1L, "ada");
            assertThat(decoded.get(1)).containsExactly(2L, null);
        }

        @Test
        @DisplayName("A local relation without data is rejected")
        void missingData() {
            Relation relation = Relation.newBuilder().setLocalRelation(LocalRelation.getDefaultInstance()).build();

            assertThatThrownBy(() -> converter.convert(relation)).isInstanceOf(PlanConversionException.class);
        }
    }

    @Test
    @DisplayName("A relation without a type is unsupported")
    void unsetRelation() {
        assertThatThrownBy(() -> converter.convert(Relation.getDefaultInstance()))
            .isInstanceOf(PlanConversionException.class)
            .hasMessage("Unsupported relation type: RELTYPE_NOT_SET");
    }
}
