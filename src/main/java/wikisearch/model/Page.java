package wikisearch.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;

@Entity
@Table(name = "pages")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(of = "url")
@ToString(exclude = "content")
public class Page {

    @Id
    @NotBlank
    @Column(nullable = false, length = 2048)
    private String url;

    @NotBlank
    @Column(nullable = false, length = 1024)
    private String title;

    @NotBlank
    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @NotNull
    @Column(nullable = false, length = 16)
    private String language;

    @NotNull
    @Column(name = "last_updated", nullable = false)
    private LocalDateTime lastUpdated;

    public Page(String url, String title, String content, String language) {
        this.url = url;
        this.title = title;
        this.content = content;
        this.language = language;
    }
}
