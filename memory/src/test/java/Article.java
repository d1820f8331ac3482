import io.github.flameyossnowy.tally.api.annotations.Counter;
import io.github.flameyossnowy.tally.api.annotations.Id;
import io.github.flameyossnowy.tally.api.annotations.ManyToMany;
import io.github.flameyossnowy.tally.api.annotations.RelationCounter;

import java.util.Set;

public class Article {
    @Id
    private Long id;

    private String title;

    @ManyToMany(target = Tag.class, relatedName = "articles")
    private Set<Long> tags;

    @RelationCounter("tags")
    private Integer tagCount;

    @RelationCounter("tags")
    private Integer tagCount2;

    @RelationCounter("comments")
    private Integer commentCount;

    @RelationCounter("comments")
    private Integer commentCount2;

    @Counter(defaultValue = "0")
    private Integer views;

    public Article() {}

    public Article(String title) {
        this.title = title;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public Integer getTagCount() {
        return tagCount;
    }

    public Integer getTagCount2() {
        return tagCount2;
    }

    public Integer getCommentCount() {
        return commentCount;
    }

    public Integer getCommentCount2() {
        return commentCount2;
    }

    public Integer getViews() {
        return views;
    }

    public void setViews(Integer views) {
        this.views = views;
    }
}
