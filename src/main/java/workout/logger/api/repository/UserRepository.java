package workout.logger.api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import workout.logger.api.entity.User;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {
}
