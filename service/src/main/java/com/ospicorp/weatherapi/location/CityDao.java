package com.ospicorp.weatherapi.location;

import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class CityDao {
  private final JdbcTemplate jdbc;

  public CityDao(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  /**
   * Looks up the cached coordinate for an exact name match. An empty result is a
   * cache miss; store failures surface as {@link org.springframework.dao.DataAccessException}.
   */
  public Optional<Coordinate> findByName(String name) {
    String sql = """
      SELECT lat, long
      FROM cities
      WHERE name = ?
    """;
    List<Coordinate> rows = jdbc.query(sql, (rs, i) -> new Coordinate(rs.getDouble(1),
                                                                       rs.getDouble(2)),
                                       name);
    return rows.stream().findFirst();
  }

  /**
   * Inserts the location unless a row with the same name exists already.
   *
   * @return true when this call created the row
   */
  public boolean insertIfAbsent(NamedLocation location) {
    String sql = """
      INSERT INTO cities (name, lat, long)
      VALUES (?, ?, ?)
      ON CONFLICT (name) DO NOTHING
    """;
    int inserted = jdbc.update(sql, location.name(),
                               location.coordinate().latitude(),
                               location.coordinate().longitude());
    return inserted > 0;
  }
}
