package com.ospicorp.weatherapi.location;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class CityDaoTest {

  @Container
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  @DynamicPropertySource
  static void configureDataSource(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
  }

  @Autowired
  private CityDao cityDao;

  @Autowired
  private JdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    jdbcTemplate.update("DELETE FROM cities");
  }

  @Test
  void migrationCreatesCitiesTable() {
    String table = jdbcTemplate.queryForObject("SELECT to_regclass('public.cities')", String.class);
    assertThat(table).isEqualTo("cities");
  }

  @Test
  void findsOnlyExactName() {
    cityDao.insertIfAbsent(new NamedLocation("Paris", new Coordinate(48.8566, 2.3522)));

    assertThat(cityDao.findByName("Paris")).contains(new Coordinate(48.8566, 2.3522));
    assertThat(cityDao.findByName("paris")).isEmpty();
    assertThat(cityDao.findByName("Paris ")).isEmpty();
  }

  @Test
  void secondInsertForSameNameKeepsFirstRow() {
    assertThat(cityDao.insertIfAbsent(new NamedLocation("Paris", new Coordinate(48.8566, 2.3522))))
        .isTrue();
    assertThat(cityDao.insertIfAbsent(new NamedLocation("Paris", new Coordinate(33.6609, -95.5555))))
        .isFalse();

    assertThat(cityDao.findByName("Paris")).contains(new Coordinate(48.8566, 2.3522));
  }

  @Test
  void concurrentInsertsLeaveSingleRow() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Callable<Boolean>> inserts = new ArrayList<>();
      for (int i = 0; i < 16; i++) {
        inserts.add(() -> cityDao.insertIfAbsent(
            new NamedLocation("Lyon", new Coordinate(45.7485, 4.8467))));
      }
      int created = 0;
      for (Future<Boolean> result : pool.invokeAll(inserts)) {
        if (result.get()) {
          created++;
        }
      }
      assertThat(created).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }

    Integer rows = jdbcTemplate.queryForObject(
        "SELECT COUNT(*) FROM cities WHERE name = ?", Integer.class, "Lyon");
    assertThat(rows).isEqualTo(1);
  }
}
