package com.storyline.narrative.store;

import com.storyline.narrative.config.SchedulingConfig;
import com.storyline.narrative.entity.ArticleRecord;
import com.storyline.narrative.entity.ClusteringStatus;
import com.storyline.narrative.entity.LifecycleState;
import com.storyline.narrative.entity.MergeTrigger;
import com.storyline.narrative.entity.Narrative;
import com.storyline.narrative.entity.NarrativeFingerprint;
import com.storyline.narrative.entity.NarrativeMergeRecord;
import com.storyline.narrative.entity.SummaryTaskStatus;
import com.storyline.narrative.entity.SummaryUpdateTask;
import com.storyline.narrative.exception.DuplicateNarrativeException;
import com.storyline.narrative.exception.FingerprintValidationException;
import com.storyline.narrative.exception.NarrativeMergeException;
import com.storyline.narrative.repository.ArticleRecordRepository;
import com.storyline.narrative.repository.SummaryUpdateTaskRepository;
import com.storyline.narrative.support.TestArticles;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Testcontainers
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({JpaNarrativeStore.class, SchedulingConfig.class})
class JpaNarrativeStoreIT {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 12, 0);

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("pgvector/pgvector:pg15")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired
    private JpaNarrativeStore store;

    @Autowired
    private ArticleRecordRepository articleRecordRepository;

    @Autowired
    private SummaryUpdateTaskRepository summaryUpdateTaskRepository;

    @Autowired
    private TestEntityManager entityManager;

    private Narrative narrative(String nucleus, String... articleIds) {
        Map<String, Double> actors = new LinkedHashMap<>();
        actors.put("Ripple", 4.0);
        Narrative narrative = Narrative.builder()
                .title(nucleus + " story")
                .nucleusEntity(nucleus)
                .creationKey(nucleus.toLowerCase() + ":" + articleIds[0])
                .fingerprint(NarrativeFingerprint.builder()
                        .nucleusEntity(nucleus)
                        .topActors(actors)
                        .computedAt(NOW)
                        .build())
                .firstSeen(NOW.minusDays(1))
                .lastUpdated(NOW)
                .build();
        narrative.replaceArticleIds(new LinkedHashSet<>(List.of(articleIds)));
        narrative.transitionTo(LifecycleState.EMERGING, NOW);
        return narrative;
    }

    private void saveArticles(String... externalIds) {
        for (String externalId : externalIds) {
            articleRecordRepository.save(TestArticles.article(externalId).nucleus("SEC").build());
        }
        articleRecordRepository.flush();
    }

    private List<SummaryUpdateTask> pendingTasks() {
        return summaryUpdateTaskRepository.findByStatusOrderByCreatedAtAsc(SummaryTaskStatus.PENDING, PageRequest.of(0, 10));
    }

    @Test
    @DisplayName("생성 시 소속 기사가 narrative에 연결된다")
    void createLinksArticles() {
        // given
        saveArticles("a1", "a2");

        // when
        Narrative created = store.create(narrative("SEC", "a1", "a2"));
        entityManager.clear();

        // then
        assertThat(created.getId()).isNotNull();
        assertThat(articleRecordRepository.findByExternalIdIn(List.of("a1", "a2")))
                .allSatisfy(article -> {
                    assertThat(article.getNarrativeId()).isEqualTo(created.getId());
                    assertThat(article.getClusteringStatus()).isEqualTo(ClusteringStatus.ASSIGNED);
                });
    }

    @Test
    @DisplayName("같은 creation key로 생성하면 DuplicateNarrativeException이 발생한다")
    void duplicateCreationKeyIsRejected() {
        // given
        saveArticles("a1");
        store.create(narrative("SEC", "a1"));

        // when / then
        assertThatThrownBy(() -> store.create(narrative("SEC", "a1")))
                .isInstanceOf(DuplicateNarrativeException.class);
    }

    @Test
    @DisplayName("기사 추가 시 요약 갱신 작업은 한 번만 쌓인다")
    void extendEnqueuesSingleSummaryTask() {
        // given
        saveArticles("a1", "a2", "a3");
        Narrative narrative = store.create(narrative("SEC", "a1"));

        // when
        narrative.replaceArticleIds(new LinkedHashSet<>(List.of("a1", "a2")));
        narrative = store.extend(narrative, List.of("a2"));
        narrative.replaceArticleIds(new LinkedHashSet<>(List.of("a1", "a2", "a3")));
        store.extend(narrative, List.of("a3"));

        // then
        assertThat(pendingTasks()).hasSize(1);
        assertThat(pendingTasks().get(0).getNarrativeId()).isEqualTo(narrative.getId());
    }

    @Test
    @DisplayName("병합하면 흡수된 narrative가 삭제되고 기사와 이력이 옮겨진다")
    void absorbMovesArticlesAndRecordsMerge() {
        // given
        saveArticles("a1", "b1");
        Narrative primary = store.create(narrative("SEC", "a1"));
        Narrative secondary = store.create(narrative("sec", "b1"));

        // when
        primary.replaceArticleIds(new LinkedHashSet<>(List.of("a1", "b1")));
        primary.getMergedFrom().add(secondary.getId());
        Narrative merged = store.absorb(primary, secondary, 0.65, MergeTrigger.DEDUP);
        entityManager.flush();
        entityManager.clear();

        // then
        assertThat(store.exists(secondary.getId())).isFalse();
        assertThat(store.findById(merged.getId())).get()
                .satisfies(n -> {
                    assertThat(n.getArticleIds()).containsExactly("a1", "b1");
                    assertThat(n.getMergedFrom()).containsExactly(secondary.getId());
                });
        assertThat(articleRecordRepository.findByExternalIdIn(List.of("b1")))
                .extracting(ArticleRecord::getNarrativeId)
                .containsExactly(primary.getId());

        List<NarrativeMergeRecord> history = store.findMergeHistory(primary.getId());
        assertThat(history).hasSize(1);
        assertThat(history.get(0).getMergedNarrativeId()).isEqualTo(secondary.getId());
        assertThat(history.get(0).getMergedNucleus()).isEqualTo("sec");
        assertThat(history.get(0).getTrigger()).isEqualTo(MergeTrigger.DEDUP);
    }

    @Test
    @DisplayName("자기 자신과는 병합할 수 없다")
    void absorbRejectsSelfMerge() {
        // given
        saveArticles("a1");
        Narrative narrative = store.create(narrative("SEC", "a1"));

        // when / then
        assertThatThrownBy(() -> store.absorb(narrative, narrative, 1.0, MergeTrigger.DEDUP))
                .isInstanceOf(NarrativeMergeException.class);
    }

    @Test
    @DisplayName("빈 nucleus를 가진 narrative는 저장되지 않는다")
    void saveRejectsEmptyNucleus() {
        // given
        Narrative invalid = narrative("SEC", "a1");
        invalid.getFingerprint().setNucleusEntity(" ");

        // when / then
        assertThatThrownBy(() -> store.save(invalid))
                .isInstanceOf(FingerprintValidationException.class);
        assertThat(store.findAll()).isEmpty();
    }
}
